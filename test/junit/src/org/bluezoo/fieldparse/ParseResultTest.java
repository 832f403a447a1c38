/*
 * ParseResultTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of fieldparse, a library for parsing structured
 * HTTP and MIME header field values.
 *
 * fieldparse is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * fieldparse is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with fieldparse.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fieldparse;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ParseResult}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ParseResultTest {

    @Test
    public void testSuccess() throws Exception {
        ParseResult<String> result = ParseResult.success("value");
        assertTrue(result.isSuccess());
        assertEquals("value", result.getValue());
        assertTrue(result.getWarnings().isEmpty());
        assertNull(result.getFailureKind());
        assertNull(result.getFailureMessage());
        assertEquals("value", result.getValueOrThrow("Test", "value"));
    }

    @Test
    public void testSuccessWithWarnings() {
        ParseResult<String> result = ParseResult.success("value", Arrays.asList("skipped a", "skipped b"));
        assertTrue(result.isSuccess());
        assertEquals(Arrays.asList("skipped a", "skipped b"), result.getWarnings());
    }

    @Test
    public void testFailure() {
        ParseResult<String> result = ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE, "bad");
        assertFalse(result.isSuccess());
        assertEquals(ParseResult.Kind.MALFORMED_VALUE, result.getFailureKind());
        assertEquals("bad", result.getFailureMessage());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetValueOfFailure() {
        ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE, "bad").getValue();
    }

    @Test
    public void testMalformedValueIsThrown() {
        try {
            ParseResult.failure(ParseResult.Kind.MALFORMED_VALUE, "bad").getValueOrThrow("Content-Type", "text");
            fail("expected MalformedValueException");
        } catch (MalformedValueException e) {
            assertEquals(MalformedValueException.class, e.getClass());
            assertEquals("Content-Type", e.getHeaderName());
            assertEquals("text", e.getHeaderValue());
            assertTrue(e.getMessage().contains("bad"));
        }
    }

    @Test(expected = MalformedParameterListException.class)
    public void testMalformedParameterListIsThrown() throws Exception {
        ParseResult.failure(ParseResult.Kind.MALFORMED_PARAMETER_LIST, "bad").getValueOrThrow("Link", "<a>; x=\"");
    }

    @Test(expected = StrictModeViolationException.class)
    public void testStrictViolationIsThrown() throws Exception {
        ParseResult.failure(ParseResult.Kind.STRICT_VIOLATION, "bad").getValueOrThrow("Accept", "text");
    }

}
