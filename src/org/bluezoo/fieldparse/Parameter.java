/*
 * Parameter.java
 * Copyright (C) 2005, 2013, 2025 Chris Burdess
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

import java.util.Locale;

/**
 * A parameter in a structured header value such as Content-Type,
 * Forwarded or Link. It consists of a name and a value.
 * Parameter names are case insensitive and are stored folded to lower
 * case.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Parameter {

	private final String name;
	private final String value;

	/**
	 * Constructor for a new parameter.
	 * @param name the name of the parameter
	 * @param value the parameter value, without any quoting
	 * @exception NullPointerException if name or value are null
	 */
	public Parameter(String name, String value) {
		if (name == null || value == null) {
			throw new NullPointerException("name and value must not be null");
		}
		this.name = name.toLowerCase(Locale.ROOT);
		this.value = value;
	}

	/**
	 * Returns the name of this parameter, in lower case.
	 * @return the parameter name
	 */
	public String getName() {
		return name;
	}

	/**
	 * Returns the unquoted value of this parameter.
	 * @return the parameter value
	 */
	public String getValue() {
		return value;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + value.hashCode();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof Parameter)) {
			return false;
		}
		Parameter o = (Parameter) other;
		return name.equals(o.name) && value.equals(o.value);
	}

	/**
	 * Returns a human-readable string representation.
	 * For wire format serialization, use {@link #toHeaderValue()}.
	 */
	@Override
	public String toString() {
		return name + "=" + value;
	}

	/**
	 * Serializes this parameter in header format.
	 * <ul>
	 * <li>token values: {@code name=value}</li>
	 * <li>values with delimiters, whitespace or empty values:
	 * {@code name="value"} with escaping</li>
	 * </ul>
	 * @return the serialized parameter suitable for inclusion in a header
	 */
	public String toHeaderValue() {
		return name + "=" + Tokens.quoteIfNeeded(value);
	}

}
