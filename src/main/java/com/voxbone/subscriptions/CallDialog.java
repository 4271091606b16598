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
import java.util.LinkedList;
import java.util.List;

/**
 * Dialog of a call, as far as subscriptions are concerned.
 * <p>
 * The dialog id is derived from the Call-ID and both tags, as seen from the
 * local side. The peer, having the tags the other way round, computes
 * {@link #getRemoteId()}.
 * </p>
 */
public class CallDialog
{
	private final String id;
	private final String serviceId;
	private final String callId;
	private final String localTag;
	private final String remoteTag;

	private String localUri;
	private String remoteUri;
	private String localTarget;
	private String remoteTarget;
	private long localSeq;
	private long remoteSeq;

	private final long created;
	private long updated;

	private final List<Subscription> subscriptions = new LinkedList<Subscription>();

	public CallDialog(String serviceId, String callId, String localTag, String remoteTag)
	{
		this.serviceId = serviceId;
		this.callId = callId;
		this.localTag = localTag;
		this.remoteTag = remoteTag;
		this.id = makeId(callId, localTag, remoteTag);
		this.created = System.currentTimeMillis();
		this.updated = created;
	}

	public static String makeId(String callId, String localTag, String remoteTag)
	{
		return SubscriptionIds.hash(callId, localTag, remoteTag);
	}

	public String getId()
	{
		return id;
	}

	/**
	 * Id the other end of the dialog uses for it
	 */
	public String getRemoteId()
	{
		return makeId(callId, remoteTag, localTag);
	}

	public DialogHandle getHandle()
	{
		return new DialogHandle(serviceId, id, callId);
	}

	public String getServiceId()
	{
		return serviceId;
	}

	public String getCallId()
	{
		return callId;
	}

	public String getLocalTag()
	{
		return localTag;
	}

	public String getRemoteTag()
	{
		return remoteTag;
	}

	public String getLocalUri()
	{
		return localUri;
	}

	public void setLocalUri(String localUri)
	{
		this.localUri = localUri;
	}

	public String getRemoteUri()
	{
		return remoteUri;
	}

	public void setRemoteUri(String remoteUri)
	{
		this.remoteUri = remoteUri;
	}

	public String getLocalTarget()
	{
		return localTarget;
	}

	public void setLocalTarget(String localTarget)
	{
		this.localTarget = localTarget;
	}

	public String getRemoteTarget()
	{
		return remoteTarget;
	}

	public void setRemoteTarget(String remoteTarget)
	{
		this.remoteTarget = remoteTarget;
	}

	public long getLocalSeq()
	{
		return localSeq;
	}

	public void setLocalSeq(long localSeq)
	{
		this.localSeq = localSeq;
	}

	public long getRemoteSeq()
	{
		return remoteSeq;
	}

	public void setRemoteSeq(long remoteSeq)
	{
		this.remoteSeq = remoteSeq;
	}

	public long getCreated()
	{
		return created;
	}

	public long getUpdated()
	{
		return updated;
	}

	public void touch()
	{
		updated = System.currentTimeMillis();
	}

	public List<Subscription> getSubscriptions()
	{
		return Collections.unmodifiableList(subscriptions);
	}

	/**
	 * @throws IllegalStateException if a subscription with the same id is already there
	 */
	public void addSubscription(Subscription subscription)
	{
		if (Subscriptions.find(subscription.getId(), this) != null)
		{
			throw new IllegalStateException("Duplicated subscription " + subscription.getId());
		}
		subscriptions.add(subscription);
		touch();
	}

	public boolean removeSubscription(Subscription subscription)
	{
		subscription.cancel();
		touch();
		return subscriptions.remove(subscription);
	}

	/**
	 * Cancels the timers of every subscription, used when the dialog goes away
	 */
	void cancelSubscriptions()
	{
		for (Subscription sub : subscriptions)
		{
			sub.cancel();
		}
	}

	@Override
	public String toString()
	{
		return "CallDialog[" + id + " " + callId + "]";
	}
}
