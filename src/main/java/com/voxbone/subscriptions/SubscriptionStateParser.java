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
import java.util.ListIterator;

import javax.sip.header.SubscriptionStateHeader;
import javax.sip.message.Message;

/**
 * Classifies the Subscription-State of a NOTIFY.
 * <p>
 * The parser keeps no state between calls and never throws: anything it cannot
 * make sense of is {@link SubscriptionState#INVALID}, so a bad header coming
 * from a peer cannot break the processing of the call.
 * </p>
 */
public final class SubscriptionStateParser
{
	private static final long ABSENT = -1;
	private static final long MALFORMED = -2;

	private SubscriptionStateParser()
	{

	}

	public static SubscriptionState parse(Message message)
	{
		List<HeaderToken> tokens = new ArrayList<HeaderToken>();
		ListIterator<?> headers = message.getHeaders(SubscriptionStateHeader.NAME);
		while (headers != null && headers.hasNext())
		{
			tokens.add(toToken((SubscriptionStateHeader) headers.next()));
		}
		return parse(tokens);
	}

	/**
	 * Token of an already parsed header; its getters give -1 for a missing number
	 */
	private static HeaderToken toToken(SubscriptionStateHeader header)
	{
		List<HeaderToken.Param> params = new ArrayList<HeaderToken.Param>();
		if (header.getExpires() != -1)
		{
			params.add(new HeaderToken.Param("expires", Integer.toString(header.getExpires())));
		}
		if (header.getReasonCode() != null)
		{
			params.add(new HeaderToken.Param("reason", header.getReasonCode()));
		}
		if (header.getRetryAfter() != -1)
		{
			params.add(new HeaderToken.Param("retry-after", Integer.toString(header.getRetryAfter())));
		}
		return new HeaderToken(header.getState() == null ? "" : header.getState(), params);
	}

	public static SubscriptionState parse(String headerValue)
	{
		return parse(HeaderTokenizer.tokenize(headerValue));
	}

	public static SubscriptionState parse(List<HeaderToken> tokens)
	{
		if (tokens == null || tokens.size() != 1)
		{
			return SubscriptionState.INVALID;
		}

		HeaderToken token = tokens.get(0);
		String name = token.getName();

		if (   SubscriptionStateHeader.ACTIVE.equalsIgnoreCase(name)
		    || SubscriptionStateHeader.PENDING.equalsIgnoreCase(name))
		{
			long expires = seconds(token.getParam("expires"));
			if (expires == MALFORMED)
			{
				return SubscriptionState.INVALID;
			}
			Integer value = expires == ABSENT ? null : Integer.valueOf((int) expires);
			return SubscriptionStateHeader.ACTIVE.equalsIgnoreCase(name)
			     ? SubscriptionState.active(value)
			     : SubscriptionState.pending(value);
		}
		else if (SubscriptionStateHeader.TERMINATED.equalsIgnoreCase(name))
		{
			long retry = seconds(token.getParam("retry-after"));
			if (retry == MALFORMED)
			{
				return SubscriptionState.INVALID;
			}

			// unknown reasons are dropped, peers may send their own tokens
			HeaderToken.Param reason = token.getParam("reason");
			return SubscriptionState.terminated(
			        reason == null ? null : TerminationReason.fromToken(reason.getValue()),
			        retry == ABSENT ? null : Integer.valueOf((int) retry));
		}

		return SubscriptionState.INVALID;
	}

	/**
	 * Non negative integer value of the parameter. A missing parameter and the
	 * value <code>-1</code> both mean "not given"; values past the int range
	 * are capped.
	 */
	private static long seconds(HeaderToken.Param param)
	{
		if (param == null)
		{
			return ABSENT;
		}

		String value = param.getValue();
		if (value == null)
		{
			return MALFORMED;
		}

		value = value.trim();
		if (value.equals("-1"))
		{
			return ABSENT;
		}
		if (value.length() == 0)
		{
			return MALFORMED;
		}
		for (int i = 0; i < value.length(); i++)
		{
			char c = value.charAt(i);
			if (c < '0' || c > '9')
			{
				return MALFORMED;
			}
		}

		// all digits, so a failure here can only be an overflow
		long number;
		try
		{
			number = Long.parseLong(value);
		}
		catch (NumberFormatException e)
		{
			number = Integer.MAX_VALUE;
		}
		return Math.min(number, Integer.MAX_VALUE);
	}
}
