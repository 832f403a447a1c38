/*
 * LinkParameterPolicy.java
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

/**
 * How {@link LinkParser} treats repeated link parameters.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum LinkParameterPolicy {

	/**
	 * Keep only the first occurrence of {@code rel}, {@code media},
	 * {@code type}, {@code title} and {@code title*}, as RFC 8288
	 * sections 3.3 and 3.4.1 require. Other parameters may repeat.
	 */
	FIRST_WINS,

	/**
	 * Keep every parameter as given.
	 */
	KEEP_ALL;

}
