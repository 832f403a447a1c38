/*
 * ContentNegotiatorTest.java
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

package org.bluezoo.fieldparse.negotiation;

import org.bluezoo.fieldparse.ContentType;
import org.bluezoo.fieldparse.ContentTypes;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.NoMatchException;
import org.bluezoo.fieldparse.parser.AcceptParser;
import org.bluezoo.fieldparse.parser.ContentTypeParser;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ContentNegotiator}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContentNegotiatorTest {

    private static ContentType type(String value) throws MalformedValueException {
        return ContentTypeParser.parse(value);
    }

    private static List<ContentType> types(String... values) throws MalformedValueException {
        ContentType[] result = new ContentType[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = type(values[i]);
        }
        return Arrays.asList(result);
    }

    @Test
    public void testHighestQualityWins() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "application/json;q=0.5, text/html", types("application/json", "text/html"));

        assertEquals(type("text/html"), result.getSelected());
        assertEquals(type("text/html"), result.getRequested());
    }

    @Test
    public void testRequestedOrderTakesPrecedence() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                AcceptParser.parse("application/json, text/html"), types("text/html", "application/json"));

        assertEquals(type("application/json"), result.getSelected());
    }

    @Test
    public void testWildcardRange() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "image/*, text/*;q=0.5", types("text/plain", "image/png"));

        assertEquals(type("image/png"), result.getSelected());
        assertEquals(type("image/*"), result.getRequested());
    }

    @Test
    public void testWildcardIgnoresAvailableParameters() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "*/*", Collections.singletonList(ContentTypes.TEXT_HTML));

        assertSame(ContentTypes.TEXT_HTML, result.getSelected());
    }

    @Test
    public void testMissingAcceptMeansAnything() throws Exception {
        List<ContentType> available = types("application/json", "text/html");

        assertEquals(type("application/json"),
                ContentNegotiator.selectContentType((String) null, available).getSelected());
        assertEquals(type("application/json"),
                ContentNegotiator.selectContentType("  ", available).getSelected());
        assertEquals(type("application/json"),
                ContentNegotiator.selectContentType(Collections.<ContentType>emptyList(), available).getSelected());
    }

    @Test
    public void testRequestedParametersMayBeMoreSpecific() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "application/json; version=2", types("application/json"));

        assertEquals(type("application/json"), result.getSelected());
        assertEquals(type("application/json; version=2"), result.getRequested());
    }

    @Test
    public void testVendorVersionSelection() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "application/vnd.example+json; version=2",
                types("application/vnd.example+json; version=3", "application/vnd.example+json; version=2"));

        assertEquals("2", result.getSelected().getParameter("version"));
        assertEquals("json", result.getSelected().getSuffix());
    }

    @Test(expected = NoMatchException.class)
    public void testAvailableParametersMustBeRequested() throws Exception {
        ContentNegotiator.selectContentType("application/json", types("application/json; version=2"));
    }

    @Test(expected = NoMatchException.class)
    public void testParameterValuesMustBeEqual() throws Exception {
        ContentNegotiator.selectContentType("application/json; version=1", types("application/json; version=2"));
    }

    @Test
    public void testMatchingParameterValue() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "application/json; version=1, application/json; version=2",
                types("application/json; version=2"));

        assertEquals("2", result.getSelected().getParameter("version"));
    }

    @Test(expected = NoMatchException.class)
    public void testZeroQualityIsNeverSelected() throws Exception {
        ContentNegotiator.selectContentType("application/json;q=0", types("application/json"));
    }

    @Test(expected = NoMatchException.class)
    public void testRefusedTypeIsNotSelectedThroughWildcard() throws Exception {
        ContentNegotiator.selectContentType("text/html;q=0, */*", types("text/html"));
    }

    @Test
    public void testRefusedTypeFallsBackToDefault() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/html;q=0, */*", Collections.singletonList(ContentTypes.TEXT_HTML), ContentTypes.TEXT_PLAIN);

        assertSame(ContentTypes.TEXT_PLAIN, result.getSelected());
    }

    @Test
    public void testRefusalSkipsToNextAvailable() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/*, text/html;q=0", types("text/html", "text/plain"));

        assertEquals(type("text/plain"), result.getSelected());
        assertEquals(type("text/*"), result.getRequested());
    }

    @Test
    public void testRefusalWithParametersIsNarrow() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/html;level=1;q=0, text/*", types("text/html; level=1", "text/html; level=2"));

        assertEquals("2", result.getSelected().getParameter("level"));
    }

    @Test
    public void testLessSpecificRefusalDoesNotVeto() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/html, */*;q=0", types("text/html"));

        assertEquals(type("text/html"), result.getSelected());
    }

    @Test
    public void testNoMatchMessage() throws Exception {
        try {
            ContentNegotiator.selectContentType("text/html, image/*;q=0.5", types("application/json"));
            fail("expected NoMatchException");
        } catch (NoMatchException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("text/html, image/*; q=0.5"));
        }
    }

    @Test
    public void testDefaultIsPairedWithItself() throws Exception {
        ContentType fallback = ContentTypes.APPLICATION_OCTET_STREAM;
        NegotiationResult result = ContentNegotiator.selectContentType(
                "image/png", types("text/html"), fallback);

        assertSame(fallback, result.getSelected());
        assertSame(fallback, result.getRequested());
        assertEquals(new NegotiationResult(fallback, fallback), result);
    }

    @Test
    public void testDefaultWithNothingAvailable() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/html", Collections.<ContentType>emptyList(), ContentTypes.TEXT_PLAIN);

        assertEquals(ContentTypes.TEXT_PLAIN, result.getSelected());
    }

    @Test
    public void testDefaultIsNotUsedWhenSomethingMatches() throws Exception {
        NegotiationResult result = ContentNegotiator.selectContentType(
                "text/html", types("text/html"), ContentTypes.TEXT_PLAIN);

        assertEquals(type("text/html"), result.getSelected());
    }

    @Test(expected = MalformedValueException.class)
    public void testMalformedAccept() throws Exception {
        ContentNegotiator.selectContentType("text/html; a=\"b", types("text/html"));
    }

    @Test
    public void testMatches() throws Exception {
        assertTrue(ContentNegotiator.matches(type("text/plain"), type("text/plain")));
        assertTrue(ContentNegotiator.matches(type("text/*"), type("text/plain")));
        assertTrue(ContentNegotiator.matches(type("*/*"), type("image/png")));
        assertTrue(ContentNegotiator.matches(type("text/plain"), type("text/*")));
        assertFalse(ContentNegotiator.matches(type("text/*"), type("image/png")));
        assertFalse(ContentNegotiator.matches(type("text/plain"), type("text/html")));
    }

    @Test
    public void testMatchesSuffix() throws Exception {
        assertTrue(ContentNegotiator.matches(type("application/*+json"), type("application/vnd.api+json")));
        assertFalse(ContentNegotiator.matches(type("application/*+json"), type("application/xml")));
        assertFalse(ContentNegotiator.matches(type("application/vnd.api+json"), type("application/vnd.api")));
        assertTrue(ContentNegotiator.matches(type("application/*"), type("application/problem+json")));
    }

}
