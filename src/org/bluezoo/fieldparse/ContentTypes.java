/*
 * ContentTypes.java
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

import java.util.Collections;
import java.util.Map;

/**
 * Well-known content types.
 * <p>
 * Equality of content types includes parameters, so
 * {@code application/json} is not equal to
 * {@code application/json; charset=utf-8}. Use the negotiation
 * algorithm to select a content type from an Accept header.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentTypes {

	private static final Map<String, String> UTF_8 = Collections.singletonMap("charset", "UTF-8");

	/** JSON, RFC 8259. */
	public static final ContentType APPLICATION_JSON = new ContentType("application", "json");

	/** The default content type for arbitrary binary data, RFC 2045. */
	public static final ContentType APPLICATION_OCTET_STREAM = new ContentType("application", "octet-stream");

	/** HTTP API problem details, RFC 9457. */
	public static final ContentType APPLICATION_PROBLEM_JSON = new ContentType("application", "problem", "json", null);

	/** XML, RFC 7303. */
	public static final ContentType APPLICATION_XML = new ContentType("application", "xml");

	/** HTML encoded as UTF-8. */
	public static final ContentType TEXT_HTML = new ContentType("text", "html", UTF_8);

	/** JavaScript encoded as UTF-8, RFC 9239. */
	public static final ContentType TEXT_JAVASCRIPT = new ContentType("text", "javascript", UTF_8);

	/** Markdown encoded as UTF-8, RFC 7763. */
	public static final ContentType TEXT_MARKDOWN = new ContentType("text", "markdown", UTF_8);

	/** Plain text, RFC 2046. */
	public static final ContentType TEXT_PLAIN = new ContentType("text", "plain");

	private ContentTypes() {
		// Static utility class
	}

}
