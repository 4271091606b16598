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


import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.sip.header.EventHeader;

/**
 * Event package of a subscription with the parameters of its Event header
 *
 */
public final class EventPackage
{
	private final String type;
	private final Map<String, String> params;

	public EventPackage(String type, Map<String, String> params)
	{
		if (type == null)
		{
			throw new IllegalArgumentException("Event type cannot be null");
		}
		this.type = type;
		this.params = Collections.unmodifiableMap(new LinkedHashMap<String, String>(params));
	}

	public EventPackage(String type)
	{
		this(type, Collections.<String, String>emptyMap());
	}

	public static EventPackage fromHeader(EventHeader header)
	{
		Map<String, String> params = new LinkedHashMap<String, String>();
		Iterator<?> names = header.getParameterNames();
		while (names.hasNext())
		{
			String name = (String) names.next();
			String value = header.getParameter(name);
			params.put(name, value == null || value.length() == 0 ? null : value);
		}
		return new EventPackage(header.getEventType(), params);
	}

	/**
	 * Implicit subscription created by the REFER with the given CSeq
	 */
	public static EventPackage refer(long cseq)
	{
		Map<String, String> params = new LinkedHashMap<String, String>();
		params.put("id", Long.toString(cseq));
		return new EventPackage(SubscriptionIds.REFER_EVENT, params);
	}

	public String getType()
	{
		return type;
	}

	public String getId()
	{
		return params.get("id");
	}

	public Map<String, String> getParams()
	{
		return params;
	}

	/**
	 * Single line header rendering, e.g. <code>dialog;id=abcd</code>
	 */
	public String toRawString()
	{
		StringBuilder sb = new StringBuilder(type);
		for (Map.Entry<String, String> param : params.entrySet())
		{
			sb.append(';').append(param.getKey());
			if (param.getValue() != null)
			{
				sb.append('=').append(param.getValue());
			}
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof EventPackage))
		{
			return false;
		}
		EventPackage other = (EventPackage) o;
		return type.equals(other.type) && params.equals(other.params);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + params.hashCode();
	}

	@Override
	public String toString()
	{
		return toRawString();
	}
}
