/*
 * CacheControlParserTest.java
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

package org.bluezoo.fieldparse.parser;

import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.StrictModeViolationException;
import org.junit.Test;

import java.util.Arrays;
import java.util.ArrayList;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CacheControlParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CacheControlParserTest {

    @Test
    public void testFlagsAndDeltaSeconds() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("public, max-age=2592000");

        assertEquals(2, directives.size());
        assertEquals(Boolean.TRUE, directives.get("public"));
        assertEquals(Long.valueOf(2592000L), directives.get("max-age"));
    }

    @Test
    public void testOrderIsPreserved() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("no-store, no-cache, must-revalidate");

        assertEquals(Arrays.asList("no-store", "no-cache", "must-revalidate"),
                new ArrayList<>(directives.keySet()));
    }

    @Test
    public void testQuotedArgument() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("private=\"Set-Cookie, Authorization\", max-age=\"60\"");

        assertEquals("Set-Cookie, Authorization", directives.get("private"));
        assertEquals(Long.valueOf(60L), directives.get("max-age"));
    }

    @Test
    public void testNonNumericArgumentIsString() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("community=UCI");

        assertEquals("UCI", directives.get("community"));
    }

    @Test
    public void testDirectiveNamesAreLowercased() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("Max-Age=5, NO-CACHE");

        assertEquals(Long.valueOf(5L), directives.get("max-age"));
        assertEquals(Boolean.TRUE, directives.get("no-cache"));
    }

    @Test
    public void testDeltaSecondsAreCapped() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("max-age=99999999999999999999, s-maxage=4294967296");

        assertEquals(Long.valueOf(CacheControlParser.MAX_DELTA_SECONDS), directives.get("max-age"));
        assertEquals(Long.valueOf(CacheControlParser.MAX_DELTA_SECONDS), directives.get("s-maxage"));
    }

    @Test
    public void testLastDirectiveWins() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse("max-age=10, max-age=20");

        assertEquals(1, directives.size());
        assertEquals(Long.valueOf(20L), directives.get("max-age"));
    }

    @Test
    public void testEmptyElementsAreIgnored() throws Exception {
        Map<String, Object> directives = CacheControlParser.parse(" , , no-cache,");

        assertEquals(1, directives.size());
        assertTrue(CacheControlParser.parse("").isEmpty());
    }

    @Test
    public void testMalformedDirectivesAreSkipped() {
        ParseResult<Map<String, Object>> result = CacheControlParser.parseWithWarnings("max-age=, =5, no cache, public", false);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getValue().size());
        assertEquals(Boolean.TRUE, result.getValue().get("public"));
        assertEquals(3, result.getWarnings().size());
    }

    @Test(expected = StrictModeViolationException.class)
    public void testMalformedDirectiveInStrictMode() throws Exception {
        CacheControlParser.parse("max-age=, public", true);
    }

    @Test(expected = MalformedValueException.class)
    public void testUnterminatedQuote() throws Exception {
        CacheControlParser.parse("private=\"Set-Cookie");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testResultIsUnmodifiable() throws Exception {
        CacheControlParser.parse("public").put("private", Boolean.TRUE);
    }

}
