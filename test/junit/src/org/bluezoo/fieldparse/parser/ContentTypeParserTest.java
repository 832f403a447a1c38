/*
 * ContentTypeParserTest.java
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

import org.bluezoo.fieldparse.ContentType;
import org.bluezoo.fieldparse.MalformedParameterListException;
import org.bluezoo.fieldparse.MalformedValueException;
import org.bluezoo.fieldparse.ParseResult;
import org.bluezoo.fieldparse.StrictModeViolationException;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ContentTypeParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContentTypeParserTest {

    @Test
    public void testParseSimple() throws Exception {
        ContentType ct = ContentTypeParser.parse("text/plain");

        assertEquals("text", ct.getPrimaryType());
        assertEquals("plain", ct.getSubType());
        assertNull(ct.getSuffix());
        assertTrue(ct.getParameters().isEmpty());
    }

    @Test
    public void testParseWithCharset() throws Exception {
        ContentType ct = ContentTypeParser.parse("Text/HTML; Charset=UTF-8");

        assertEquals("text", ct.getPrimaryType());
        assertEquals("html", ct.getSubType());
        assertEquals("UTF-8", ct.getParameter("charset"));
    }

    @Test
    public void testParseWithQuotedParameter() throws Exception {
        ContentType ct = ContentTypeParser.parse("multipart/form-data; boundary=\"----=_Part_123\"");

        assertEquals("multipart", ct.getPrimaryType());
        assertEquals("form-data", ct.getSubType());
        assertEquals("----=_Part_123", ct.getParameter("boundary"));
    }

    @Test
    public void testParseMultipleParameters() throws Exception {
        ContentType ct = ContentTypeParser.parse("text/plain; charset=utf-8; format=flowed; delsp=yes");

        assertEquals("utf-8", ct.getParameter("charset"));
        assertEquals("flowed", ct.getParameter("format"));
        assertEquals("yes", ct.getParameter("delsp"));
    }

    @Test
    public void testParseWithWhitespace() throws Exception {
        ContentType ct = ContentTypeParser.parse("  text/plain  ;  charset = utf-8  ");

        assertEquals("text", ct.getPrimaryType());
        assertEquals("plain", ct.getSubType());
        assertEquals("utf-8", ct.getParameter("charset"));
    }

    @Test
    public void testParseWithComments() throws Exception {
        ContentType ct = ContentTypeParser.parse("text/html (web page); charset=utf-8 (unicode)");

        assertEquals("html", ct.getSubType());
        assertEquals("utf-8", ct.getParameter("charset"));
    }

    @Test
    public void testParseSuffix() throws Exception {
        ContentType ct = ContentTypeParser.parse("application/vnd.api+json; charset=utf-8");

        assertEquals("application", ct.getPrimaryType());
        assertEquals("vnd.api", ct.getSubType());
        assertEquals("json", ct.getSuffix());
        assertEquals("application/vnd.api+json; charset=utf-8", ct.toString());
    }

    @Test
    public void testParseWildcard() throws Exception {
        ContentType ct = ContentTypeParser.parse("*/*");

        assertTrue(ct.isWildcardType());
        assertTrue(ct.isWildcardSubType());
    }

    @Test
    public void testLastParameterWins() throws Exception {
        ContentType ct = ContentTypeParser.parse("text/plain; charset=us-ascii; charset=utf-8");

        assertEquals(1, ct.getParameters().size());
        assertEquals("utf-8", ct.getParameter("charset"));
    }

    @Test
    public void testRoundTrip() throws Exception {
        String[] values = {
            "text/plain",
            "application/vnd.api+json",
            "text/plain; format=flowed; charset=\"utf 8\"",
            "multipart/mixed; boundary=\"a;b\"",
        };
        for (String value : values) {
            ContentType ct = ContentTypeParser.parse(value);
            assertEquals(value, ct, ContentTypeParser.parse(ct.toString()));
        }
    }

    @Test
    public void testMalformedParameterIsSkipped() throws Exception {
        ParseResult<ContentType> result =
                ContentTypeParser.tryParse("text/plain; charset=utf-8; bad name=x", ScanOptions.CONTENT_TYPE);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getValue().getParameters().size());
        assertEquals(1, result.getWarnings().size());
    }

    @Test(expected = StrictModeViolationException.class)
    public void testMalformedParameterInStrictMode() throws Exception {
        ContentTypeParser.parse("text/plain; charset=utf-8; bad name=x", true);
    }

    @Test(expected = MalformedValueException.class)
    public void testMissingSlash() throws Exception {
        ContentTypeParser.parse("text");
    }

    @Test(expected = MalformedValueException.class)
    public void testMissingSubType() throws Exception {
        ContentTypeParser.parse("text/");
    }

    @Test(expected = MalformedValueException.class)
    public void testInvalidType() throws Exception {
        ContentTypeParser.parse("te xt/plain");
    }

    @Test(expected = MalformedValueException.class)
    public void testEmptySuffix() throws Exception {
        ContentTypeParser.parse("application/json+");
    }

    @Test(expected = MalformedValueException.class)
    public void testEmptySubTypeBeforeSuffix() throws Exception {
        ContentTypeParser.parse("application/+json");
    }

    @Test(expected = MalformedParameterListException.class)
    public void testUnterminatedQuote() throws Exception {
        ContentTypeParser.parse("text/plain; charset=\"utf-8");
    }

    @Test(expected = MalformedValueException.class)
    public void testUnterminatedCommentInType() throws Exception {
        ContentTypeParser.parse("text/plain (comment");
    }

    @Test
    public void testFailureCarriesHeaderName() {
        try {
            ContentTypeParser.parse("nonsense");
            fail("expected MalformedValueException");
        } catch (MalformedValueException e) {
            assertEquals("Content-Type", e.getHeaderName());
            assertEquals("nonsense", e.getHeaderValue());
        }
    }

}
