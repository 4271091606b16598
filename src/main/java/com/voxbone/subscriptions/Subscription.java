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


import java.util.concurrent.ScheduledFuture;

/**
 * A SIP event subscription, owned by its {@link CallDialog}.
 * <p>
 * Instances are only touched from the worker of the call owning the dialog.
 * </p>
 */
public class Subscription
{
	private final String id;
	private final EventPackage event;
	private final SubscriptionClass subscriptionClass;

	private SubscriptionState status;
	private boolean answered = false;
	private ScheduledFuture<?> expiryTimer;
	private long timerGeneration = 0;

	public Subscription(String id, EventPackage event, SubscriptionClass subscriptionClass, SubscriptionState status)
	{
		this.id = id;
		this.event = event;
		this.subscriptionClass = subscriptionClass;
		this.status = status;
	}

	public String getId()
	{
		return id;
	}

	public EventPackage getEvent()
	{
		return event;
	}

	public SubscriptionClass getSubscriptionClass()
	{
		return subscriptionClass;
	}

	public SubscriptionState getStatus()
	{
		return status;
	}

	public void setStatus(SubscriptionState status)
	{
		if (status.isInvalid())
		{
			throw new IllegalArgumentException("A subscription cannot be in the invalid state");
		}
		this.status = status;
	}

	/**
	 * Whether the first NOTIFY has been seen
	 */
	public boolean isAnswered()
	{
		return answered;
	}

	public void setAnswered(boolean answered)
	{
		this.answered = answered;
	}

	public ScheduledFuture<?> getExpiryTimer()
	{
		return expiryTimer;
	}

	/**
	 * Replaces the expiry timer, cancelling the previous one
	 */
	public void setExpiryTimer(ScheduledFuture<?> timer)
	{
		cancel();
		this.expiryTimer = timer;
	}

	/**
	 * Bumped every time the timer is replaced or cancelled, so an expiration
	 * queued by an older timer can be recognised
	 */
	public long getTimerGeneration()
	{
		return timerGeneration;
	}

	public void cancel()
	{
		timerGeneration++;
		if (expiryTimer != null)
		{
			expiryTimer.cancel(false);
			expiryTimer = null;
		}
	}

	@Override
	public String toString()
	{
		return "Subscription[" + id + " " + event + " " + status + "]";
	}
}
