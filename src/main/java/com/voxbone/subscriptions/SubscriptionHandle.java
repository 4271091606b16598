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
 * Portable reference to a subscription: the service, the subscription identity,
 * the owning dialog and the owning call.
 * <p>
 * A handle holds no live state. Resolving it goes through the call that owns
 * the dialog and fails once the call, dialog or subscription is gone.
 * </p>
 */
public final class SubscriptionHandle
{
	private final String serviceId;
	private final String subscriptionId;
	private final String dialogId;
	private final String callId;

	public SubscriptionHandle(String serviceId, String subscriptionId, String dialogId, String callId)
	{
		if (serviceId == null || subscriptionId == null || dialogId == null || callId == null)
		{
			throw new IllegalArgumentException("Handle elements cannot be null");
		}
		this.serviceId = serviceId;
		this.subscriptionId = subscriptionId;
		this.dialogId = dialogId;
		this.callId = callId;
	}

	/**
	 * Decodes a <code>U_</code> handle.
	 *
	 * @throws InvalidHandleException on a wrong prefix or an undecodable payload
	 */
	public static SubscriptionHandle parse(String handle) throws InvalidHandleException
	{
		String [] e = HandleCodec.decode(HandleCodec.SUBSCRIPTION_PREFIX, 4, handle);
		return new SubscriptionHandle(e[0], e[1], e[2], e[3]);
	}

	public String encode()
	{
		return HandleCodec.encode(HandleCodec.SUBSCRIPTION_PREFIX, serviceId, subscriptionId, dialogId, callId);
	}

	/**
	 * Handle of the dialog owning this subscription
	 */
	public DialogHandle getDialogHandle()
	{
		return new DialogHandle(serviceId, dialogId, callId);
	}

	public String getServiceId()
	{
		return serviceId;
	}

	public String getSubscriptionId()
	{
		return subscriptionId;
	}

	public String getDialogId()
	{
		return dialogId;
	}

	public String getCallId()
	{
		return callId;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SubscriptionHandle))
		{
			return false;
		}
		SubscriptionHandle other = (SubscriptionHandle) o;
		return serviceId.equals(other.serviceId)
		    && subscriptionId.equals(other.subscriptionId)
		    && dialogId.equals(other.dialogId)
		    && callId.equals(other.callId);
	}

	@Override
	public int hashCode()
	{
		int h = serviceId.hashCode();
		h = 31 * h + subscriptionId.hashCode();
		h = 31 * h + dialogId.hashCode();
		return 31 * h + callId.hashCode();
	}

	@Override
	public String toString()
	{
		return encode();
	}
}
