/*
 * UrlAuth.java
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

package org.bluezoo.fieldparse.url;

/**
 * The user information removed from a URL, and the URL without it.
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UrlAuth {

	private final String username;
	private final String password;
	private final String url;

	UrlAuth(String username, String password, String url) {
		this.username = username;
		this.password = password;
		this.url = url;
	}

	/**
	 * Returns the decoded user name.
	 * @return the user name, or null if the URL had none
	 */
	public String getUsername() {
		return username;
	}

	/**
	 * Returns the decoded password.
	 * @return the password, or null if the URL had none
	 */
	public String getPassword() {
		return password;
	}

	/**
	 * Returns the URL without user information.
	 * @return the sanitized URL
	 */
	public String getUrl() {
		return url;
	}

	@Override
	public String toString() {
		// never include the password
		return "UrlAuth[username=" + username + ", url=" + url + "]";
	}

}
