/*
 * LinkHeader.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A single link from a Link header: a target URI-reference and its
 * parameters.
 * <p>
 * Parameters are kept as an ordered list rather than a map because
 * some of them, such as {@code hreflang}, may legally repeat.
 * @see <a href='https://www.rfc-editor.org/rfc/rfc8288#section-3'>RFC 8288</a>
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LinkHeader {

	private final String target;
	private final List<Parameter> parameters;

	/**
	 * Constructor for a link without parameters.
	 * @param target the link target
	 * @exception NullPointerException if target is null
	 * @exception IllegalArgumentException if target is empty
	 */
	public LinkHeader(String target) {
		this(target, null);
	}

	/**
	 * Constructor.
	 * @param target the link target, which may be a relative reference
	 * @param parameters the link parameters in order. May be null
	 * @exception NullPointerException if target is null
	 * @exception IllegalArgumentException if target is empty
	 */
	public LinkHeader(String target, List<Parameter> parameters) {
		if (target == null) {
			throw new NullPointerException("target must not be null");
		}
		this.target = target.trim();
		if (this.target.isEmpty()) {
			throw new IllegalArgumentException("target must not be empty");
		}
		if (parameters == null || parameters.isEmpty()) {
			this.parameters = Collections.emptyList();
		} else {
			this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
		}
	}

	/**
	 * Returns the target of this link. It may be a relative reference
	 * which the caller must resolve against the request URI.
	 * @return the target
	 */
	public String getTarget() {
		return target;
	}

	/**
	 * Returns the parameters of this link in order.
	 * @return an unmodifiable list of parameters
	 */
	public List<Parameter> getParameters() {
		return parameters;
	}

	/**
	 * Returns every value of the named parameter, in order.
	 * @param name the parameter name, case insensitive
	 * @return the values, empty if the parameter is absent
	 */
	public List<String> getParameterValues(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		List<String> values = new ArrayList<>();
		for (Parameter parameter : parameters) {
			if (parameter.getName().equals(key)) {
				values.add(parameter.getValue());
			}
		}
		return values;
	}

	/**
	 * Returns the first value of the named parameter.
	 * @param name the parameter name, case insensitive
	 * @return the value, or null if the parameter is absent
	 */
	public String getParameter(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		for (Parameter parameter : parameters) {
			if (parameter.getName().equals(key)) {
				return parameter.getValue();
			}
		}
		return null;
	}

	/**
	 * Indicates whether this link has the named parameter.
	 * @param name the parameter name, case insensitive
	 * @return true if at least one such parameter is present
	 */
	public boolean hasParameter(String name) {
		return getParameter(name) != null;
	}

	/**
	 * Returns the relation types of this link, every {@code rel} value
	 * joined by a single space.
	 * @return the relation types, or an empty string if there is no
	 * {@code rel} parameter
	 */
	public String getRel() {
		StringBuilder buf = new StringBuilder();
		for (String rel : getParameterValues("rel")) {
			String trimmed = rel.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			if (buf.length() > 0) {
				buf.append(' ');
			}
			buf.append(trimmed);
		}
		return buf.toString();
	}

	@Override
	public boolean equals(Object other) {
		if (!(other instanceof LinkHeader)) {
			return false;
		}
		LinkHeader o = (LinkHeader) other;
		return target.equals(o.target) && parameters.equals(o.parameters);
	}

	@Override
	public int hashCode() {
		return target.hashCode() * 31 + parameters.hashCode();
	}

	/**
	 * Serializes this link in header format: the bracketed target,
	 * then the combined {@code rel}, then the remaining parameters in
	 * sorted order. Values are written as quoted-strings, except
	 * extended ({@code name*}) values that are tokens and valueless
	 * parameters.
	 */
	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		buf.append('<').append(target).append('>');
		String rel = getRel();
		if (!rel.isEmpty()) {
			buf.append("; rel=").append(Tokens.quote(rel));
		}
		List<String> formatted = new ArrayList<>();
		for (Parameter parameter : parameters) {
			if (!"rel".equals(parameter.getName())) {
				formatted.add(format(parameter));
			}
		}
		Collections.sort(formatted);
		for (String s : formatted) {
			buf.append("; ").append(s);
		}
		return buf.toString();
	}

	private static String format(Parameter parameter) {
		String name = parameter.getName();
		String value = parameter.getValue();
		if (value.isEmpty()) {
			return name;
		}
		if (name.endsWith("*") && Tokens.isToken(value)) {
			return name + "=" + value;
		}
		return name + "=" + Tokens.quote(value);
	}

}
