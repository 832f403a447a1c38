/*
 * package-info.java
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

/**
 * Structured header field values.
 *
 * <p>This package holds the value types produced and consumed by the
 * header parsers and the negotiation algorithm.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.fieldparse.ContentType} - a media type with
 *       parameters and an optional quality</li>
 *   <li>{@link org.bluezoo.fieldparse.LinkHeader} - one link of a Link
 *       header</li>
 *   <li>{@link org.bluezoo.fieldparse.Parameter} - a name/value pair</li>
 *   <li>{@link org.bluezoo.fieldparse.ParseResult} - the outcome of a
 *       parse, including the elements lenient parsing skipped</li>
 *   <li>{@link org.bluezoo.fieldparse.Tokens} - token and quoted-string
 *       helpers</li>
 * </ul>
 *
 * <h2>Subpackages</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.fieldparse.parser} - header parsers</li>
 *   <li>{@link org.bluezoo.fieldparse.negotiation} - proactive content
 *       negotiation</li>
 *   <li>{@link org.bluezoo.fieldparse.url} - URL rewriting</li>
 * </ul>
 *
 * <p>All types are immutable and all operations are free of side
 * effects, so they may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.fieldparse;
