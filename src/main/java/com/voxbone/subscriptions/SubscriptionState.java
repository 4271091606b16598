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


/**
 * Subscription state, as carried by a Subscription-State header and as kept
 * in {@link Subscription#getStatus()}.
 * <p>
 * {@link #INVALID} is the classification of a malformed header, never the
 * status of a live subscription.
 * </p>
 */
public final class SubscriptionState
{
	public enum Kind
	{
		ACTIVE,
		PENDING,
		TERMINATED,
		INVALID
	}

	public static final SubscriptionState INVALID = new SubscriptionState(Kind.INVALID, null, null, null);

	private final Kind kind;
	private final Integer expires;
	private final TerminationReason reason;
	private final Integer retryAfter;

	private SubscriptionState(Kind kind, Integer expires, TerminationReason reason, Integer retryAfter)
	{
		this.kind = kind;
		this.expires = expires;
		this.reason = reason;
		this.retryAfter = retryAfter;
	}

	public static SubscriptionState active(Integer expires)
	{
		return new SubscriptionState(Kind.ACTIVE, expires, null, null);
	}

	public static SubscriptionState pending(Integer expires)
	{
		return new SubscriptionState(Kind.PENDING, expires, null, null);
	}

	public static SubscriptionState terminated(TerminationReason reason, Integer retryAfter)
	{
		return new SubscriptionState(Kind.TERMINATED, null, reason, retryAfter);
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * Seconds, <code>null</code> if not given. Only for active and pending.
	 */
	public Integer getExpires()
	{
		return expires;
	}

	public TerminationReason getReason()
	{
		return reason;
	}

	public Integer getRetryAfter()
	{
		return retryAfter;
	}

	public boolean isInvalid()
	{
		return kind == Kind.INVALID;
	}

	public boolean isTerminated()
	{
		return kind == Kind.TERMINATED;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SubscriptionState))
		{
			return false;
		}
		SubscriptionState other = (SubscriptionState) o;
		return kind == other.kind
		    && same(expires, other.expires)
		    && reason == other.reason
		    && same(retryAfter, other.retryAfter);
	}

	private static boolean same(Object a, Object b)
	{
		return a == null ? b == null : a.equals(b);
	}

	@Override
	public int hashCode()
	{
		int h = kind.hashCode();
		h = 31 * h + (expires == null ? 0 : expires.hashCode());
		h = 31 * h + (reason == null ? 0 : reason.hashCode());
		return 31 * h + (retryAfter == null ? 0 : retryAfter.hashCode());
	}

	@Override
	public String toString()
	{
		switch (kind)
		{
			case ACTIVE:
			case PENDING:
				return kind.name().toLowerCase() + (expires == null ? "" : ";expires=" + expires);
			case TERMINATED:
				return "terminated"
				     + (reason == null ? "" : ";reason=" + reason.getToken())
				     + (retryAfter == null ? "" : ";retry-after=" + retryAfter);
			default:
				return "invalid";
		}
	}
}
