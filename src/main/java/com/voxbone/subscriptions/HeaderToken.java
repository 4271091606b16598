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
import java.util.Collections;
import java.util.List;

/**
 * One token of a tokenized header value: a name and its <code>;param=value</code> list
 *
 */
public final class HeaderToken
{
	public static final class Param
	{
		private final String name;
		private final String value;

		public Param(String name, String value)
		{
			this.name = name;
			this.value = value;
		}

		public String getName()
		{
			return name;
		}

		/**
		 * @return the value, <code>null</code> for a parameter without one
		 */
		public String getValue()
		{
			return value;
		}
	}

	private final String name;
	private final List<Param> params;

	public HeaderToken(String name, List<Param> params)
	{
		this.name = name;
		this.params = Collections.unmodifiableList(new ArrayList<Param>(params));
	}

	public HeaderToken(String name)
	{
		this(name, Collections.<Param>emptyList());
	}

	public String getName()
	{
		return name;
	}

	public List<Param> getParams()
	{
		return params;
	}

	/**
	 * First parameter with that name (case insensitive), or <code>null</code>
	 */
	public Param getParam(String paramName)
	{
		for (Param p : params)
		{
			if (p.name.equalsIgnoreCase(paramName))
			{
				return p;
			}
		}
		return null;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(name);
		for (Param p : params)
		{
			sb.append(';').append(p.name);
			if (p.value != null)
			{
				sb.append('=').append(p.value);
			}
		}
		return sb.toString();
	}
}
