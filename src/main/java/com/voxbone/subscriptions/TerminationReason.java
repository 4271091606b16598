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


import javax.sip.header.SubscriptionStateHeader;

/**
 * Reasons of a <code>terminated</code> Subscription-State the dialog layer acts on.
 * Any other reason token is handled as no reason at all.
 *
 */
public enum TerminationReason
{
	DEACTIVATED(SubscriptionStateHeader.DEACTIVATED, false),
	PROBATION(SubscriptionStateHeader.PROBATION, true),
	REJECTED(SubscriptionStateHeader.REJECTED, false),
	TIMEOUT(SubscriptionStateHeader.TIMEOUT, false),
	GIVEUP(SubscriptionStateHeader.GIVE_UP, true);

	private final String token;
	private final boolean retryCapable;

	private TerminationReason(String token, boolean retryCapable)
	{
		this.token = token;
		this.retryCapable = retryCapable;
	}

	public String getToken()
	{
		return token;
	}

	/**
	 * Whether a <code>retry-after</code> is meaningful with this reason
	 */
	public boolean isRetryCapable()
	{
		return retryCapable;
	}

	/**
	 * @return the matching reason, or <code>null</code> for an unknown token
	 */
	public static TerminationReason fromToken(String token)
	{
		if (token == null)
		{
			return null;
		}
		for (TerminationReason reason : values())
		{
			if (reason.token.equalsIgnoreCase(token))
			{
				return reason;
			}
		}
		return null;
	}
}
