/**
 *    Copyright 2012 Voxbone SA/NV
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package com.voxbone.subscriptions;


import java.util.ArrayList;
import java.util.List;

/**
 * Splits a header value of the form <code>name *(;param[=value])</code>, with
 * several tokens separated by commas, into {@link HeaderToken}s.
 * Separators inside double quotes are not split on.
 *
 */
public final class HeaderTokenizer
{
	private HeaderTokenizer()
	{

	}

	public static List<HeaderToken> tokenize(String value)
	{
		List<HeaderToken> tokens = new ArrayList<HeaderToken>();
		if (value == null)
		{
			return tokens;
		}

		for (String part : split(value, ','))
		{
			List<String> segments = split(part, ';');
			String name = segments.get(0).trim();
			if (name.length() == 0)
			{
				continue;
			}

			List<HeaderToken.Param> params = new ArrayList<HeaderToken.Param>();
			for (int i = 1; i < segments.size(); i++)
			{
				String segment = segments.get(i).trim();
				if (segment.length() == 0)
				{
					continue;
				}

				int eq = segment.indexOf('=');
				if (eq < 0)
				{
					params.add(new HeaderToken.Param(segment.toLowerCase(), null));
				}
				else
				{
					String pName = segment.substring(0, eq).trim().toLowerCase();
					String pValue = unquote(segment.substring(eq + 1).trim());
					params.add(new HeaderToken.Param(pName, pValue));
				}
			}
			tokens.add(new HeaderToken(name, params));
		}
		return tokens;
	}

	private static List<String> split(String text, char separator)
	{
		List<String> parts = new ArrayList<String>();
		StringBuilder current = new StringBuilder();
		boolean quoted = false;

		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c == '"')
			{
				quoted = !quoted;
			}
			else if (c == '\\' && quoted && i + 1 < text.length())
			{
				current.append(c);
				c = text.charAt(++i);
			}
			else if (c == separator && !quoted)
			{
				parts.add(current.toString());
				current.setLength(0);
				continue;
			}
			current.append(c);
		}
		parts.add(current.toString());
		return parts;
	}

	private static String unquote(String value)
	{
		if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"')
		{
			return value.substring(1, value.length() - 1).replaceAll("\\\\(.)", "$1");
		}
		return value;
	}
}
