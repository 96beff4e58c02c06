package com.di.fragnova;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for FragNovaApplication. The full context is exercised by the REST API tests.
 */
@DisplayName("FragNovaApplication Tests")
class FragNovaApplicationTests {

	@Test
	@DisplayName("Should have a public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = FragNovaApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}
}
