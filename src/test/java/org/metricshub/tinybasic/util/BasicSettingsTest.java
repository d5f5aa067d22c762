package org.metricshub.tinybasic.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class BasicSettingsTest {

	@Test
	public void testDefaults() {
		BasicSettings settings = new BasicSettings();
		assertEquals("> ", settings.getPrompt());
		assertEquals("Ready!", settings.getBanner());
		assertFalse(settings.isEchoInput());
		assertEquals(1024, settings.getMaxGosubDepth());
		assertEquals(0, settings.getStepsPerSlice());
		assertEquals("program.bas", settings.getProgramFile());
		assertSame(System.out, settings.getOutputStream());
	}

	@Test
	public void testLimitsAreValidated() {
		BasicSettings settings = new BasicSettings();
		assertThrows(IllegalArgumentException.class, () -> settings.setMaxGosubDepth(0));
		assertThrows(IllegalArgumentException.class, () -> settings.setStepsPerSlice(-1));
		settings.setStepsPerSlice(0);
		settings.setMaxGosubDepth(1);
		assertEquals(1, settings.getMaxGosubDepth());
	}

	@Test
	public void testDescription() {
		BasicSettings settings = new BasicSettings();
		settings.setEchoInput(true);
		String description = settings.toDescriptionString();
		assertTrue(description.contains("echoInput = true\n"));
		assertTrue(description.contains("maxGosubDepth = 1024\n"));
	}
}
