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
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;
import java.util.ResourceBundle;

import org.apache.log4j.Logger;

/**
 * Settings of the subscription layer, read from a properties resource.
 * <p>
 * Keys are prefixed with <code>com.voxbone.subscriptions.</code>; a missing key
 * takes its default, a value out of range is rejected when loading.
 * </p>
 */
public class ServiceConfig
{
	public static final String PREFIX = "com.voxbone.subscriptions.";

	public static final String EVENT_EXPIRES = PREFIX + "event_expires";
	public static final String EVENT_EXPIRES_OFFSET = PREFIX + "event_expires_offset";
	public static final String CALL_TIMEOUT = PREFIX + "call_timeout";
	public static final String MAX_CALLS = PREFIX + "max_calls";
	public static final String EVENTS = PREFIX + "events";

	private static Logger logger = Logger.getLogger(ServiceConfig.class);

	private final int eventExpires;
	private final int eventExpiresOffset;
	private final long callTimeout;
	private final int maxCalls;
	private final List<String> events;

	public ServiceConfig(Properties properties)
	{
		eventExpires = getInteger(properties, EVENT_EXPIRES, 60, 1, Integer.MAX_VALUE);
		eventExpiresOffset = getInteger(properties, EVENT_EXPIRES_OFFSET, 5, 0, Integer.MAX_VALUE);
		callTimeout = getInteger(properties, CALL_TIMEOUT, 30000, 1, Integer.MAX_VALUE);
		maxCalls = getInteger(properties, MAX_CALLS, 100000, 1, 1000000);

		List<String> list = new ArrayList<String>();
		for (String event : properties.getProperty(EVENTS, "").split(","))
		{
			if (event.trim().length() > 0)
			{
				list.add(event.trim());
			}
		}
		events = Collections.unmodifiableList(list);
	}

	public ServiceConfig()
	{
		this(new Properties());
	}

	/**
	 * Reads the named resource bundle, e.g. <code>subscriptions</code> for
	 * <code>subscriptions.properties</code> on the classpath
	 */
	public static ServiceConfig load(String name)
	{
		Properties props = new Properties();

		ResourceBundle rb = ResourceBundle.getBundle(name);
		Enumeration<String> keys = rb.getKeys();

		while (keys.hasMoreElements())
		{
			String key = keys.nextElement();
			props.setProperty(key, rb.getString(key));
		}

		ServiceConfig config = new ServiceConfig(props);
		logger.info("Loaded configuration " + name + ": " + config);
		return config;
	}

	private static int getInteger(Properties properties, String key, int def, int min, int max)
	{
		String value = properties.getProperty(key);
		if (value == null || value.trim().length() == 0)
		{
			return def;
		}

		int number;
		try
		{
			number = Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
		}

		if (number < min || number > max)
		{
			throw new IllegalArgumentException("Value of " + key + " out of range [" + min + ", " + max + "]: " + value);
		}
		return number;
	}

	/**
	 * Seconds a subscription lasts when the request does not say
	 */
	public int getEventExpires()
	{
		return eventExpires;
	}

	/**
	 * Seconds added to every expiry timer
	 */
	public int getEventExpiresOffset()
	{
		return eventExpiresOffset;
	}

	/**
	 * Milliseconds to wait for a call to run a function
	 */
	public long getCallTimeout()
	{
		return callTimeout;
	}

	public int getMaxCalls()
	{
		return maxCalls;
	}

	/**
	 * Accepted event packages, empty when any is
	 */
	public List<String> getEvents()
	{
		return events;
	}

	public boolean isSupportedEvent(String event)
	{
		if (events.isEmpty())
		{
			return true;
		}
		for (String e : events)
		{
			if (e.equalsIgnoreCase(event))
			{
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString()
	{
		return "event_expires=" + eventExpires
		     + " event_expires_offset=" + eventExpiresOffset
		     + " call_timeout=" + callTimeout
		     + " max_calls=" + maxCalls
		     + " events=" + events;
	}
}
