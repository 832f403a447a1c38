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
 * Parsers for structured header field values.
 *
 * <p>Every parser is a static, side-effect free function from the
 * header value to the value types of {@link org.bluezoo.fieldparse}.
 * Parsers are lenient by default: an element that cannot be
 * understood is skipped and logged at {@code FINE}. The
 * {@code parseWithWarnings} and {@code tryParse} forms return a
 * {@link org.bluezoo.fieldparse.ParseResult} listing what was skipped,
 * and every parser accepts a strict flag that turns a skip into a
 * {@link org.bluezoo.fieldparse.StrictModeViolationException}.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.fieldparse.parser.ParameterParser} - the
 *       parameter list scanner shared by the header parsers, configured
 *       by {@link org.bluezoo.fieldparse.parser.ScanOptions}</li>
 *   <li>{@link org.bluezoo.fieldparse.parser.ListParser} - comma list
 *       splitting</li>
 *   <li>{@link org.bluezoo.fieldparse.parser.ContentTypeParser},
 *       {@link org.bluezoo.fieldparse.parser.AcceptParser} and
 *       {@link org.bluezoo.fieldparse.parser.QualityListParser} - media
 *       types and the Accept family</li>
 *   <li>{@link org.bluezoo.fieldparse.parser.CacheControlParser},
 *       {@link org.bluezoo.fieldparse.parser.ForwardedParser} and
 *       {@link org.bluezoo.fieldparse.parser.LinkParser}</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.fieldparse.parser;
