package org.metricshub.tinybasic.jrt;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;

public class BufferedIoBridgeTest {

	@Test
	public void testInputInOrder() {
		BufferedIoBridge bridge = new BufferedIoBridge("1", "2");
		bridge.addInput("3");
		assertEquals("1", bridge.readLine());
		assertEquals("2", bridge.readLine());
		assertEquals("3", bridge.readLine());
		assertNull(bridge.readLine());
	}

	@Test
	public void testOutputAndClear() {
		BufferedIoBridge bridge = new BufferedIoBridge();
		bridge.write("A\n");
		bridge.clear();
		bridge.write("B\n");
		assertEquals("B\n", bridge.getOutput());
		assertEquals(1, bridge.getClearCount());
	}

	@Test
	public void testPromptsAreRecorded() {
		BufferedIoBridge bridge = new BufferedIoBridge();
		bridge.setPrompt("> ");
		bridge.setPrompt("A? ");
		assertEquals(Arrays.asList("> ", "A? "), bridge.getPrompts());
		assertEquals("", bridge.getOutput());
	}

	@Test
	public void testProgramStorage() {
		BufferedIoBridge bridge = new BufferedIoBridge();
		assertNull(bridge.loadProgram());
		bridge.saveProgram("10 END");
		assertEquals("10 END", bridge.loadProgram());
		assertEquals("10 END", bridge.getStoredProgram());
	}
}
