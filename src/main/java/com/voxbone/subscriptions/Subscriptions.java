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


import javax.sip.header.CallIdHeader;
import javax.sip.message.Message;

/**
 * Entry points for handles, identities and lookups of subscriptions
 *
 */
public final class Subscriptions
{
	private Subscriptions()
	{

	}

	public static SubscriptionHandle makeHandle(Subscription subscription, CallDialog dialog)
	{
		return new SubscriptionHandle(dialog.getServiceId(), subscription.getId(), dialog.getId(), dialog.getCallId());
	}

	/**
	 * Handle of a {@link SubscriptionRef} or of a {@link MessageRef}. An encoded
	 * subscription handle is returned as is. A bare {@link Message} names no
	 * service or dialog and is rejected; wrap it in a {@link MessageRef} or use
	 * {@link #getHandle(Message, String, String)}.
	 *
	 * @throws InvalidSubscriptionException for anything else
	 */
	public static String getHandle(Object ref) throws InvalidSubscriptionException
	{
		if (ref instanceof SubscriptionRef)
		{
			SubscriptionRef r = (SubscriptionRef) ref;
			return makeHandle(r.getSubscription(), r.getDialog()).encode();
		}
		else if (ref instanceof MessageRef)
		{
			MessageRef r = (MessageRef) ref;
			return getHandle(r.getMessage(), r.getServiceId(), r.getDialogId());
		}
		else if (ref instanceof String && ((String) ref).startsWith(HandleCodec.SUBSCRIPTION_PREFIX))
		{
			return (String) ref;
		}
		throw new InvalidSubscriptionException(String.valueOf(ref));
	}

	/**
	 * Handle of the subscription a message belongs to, inside the given dialog
	 */
	public static String getHandle(Message message, String serviceId, String dialogId) throws InvalidSubscriptionException
	{
		if (message == null)
		{
			throw new InvalidSubscriptionException("null");
		}
		CallIdHeader callId = (CallIdHeader) message.getHeader(CallIdHeader.NAME);
		if (callId == null || serviceId == null || dialogId == null)
		{
			throw new InvalidSubscriptionException("message without call or dialog");
		}
		return new SubscriptionHandle(serviceId, makeId(message), dialogId, callId.getCallId()).encode();
	}

	public static SubscriptionHandle parseHandle(String handle) throws InvalidHandleException
	{
		return SubscriptionHandle.parse(handle);
	}

	public static String makeId(Message message)
	{
		return SubscriptionIds.makeId(message);
	}

	/**
	 * @return the subscription with that id, or <code>null</code>
	 */
	public static Subscription find(String id, CallDialog dialog)
	{
		for (Subscription sub : dialog.getSubscriptions())
		{
			if (sub.getId().equals(id))
			{
				return sub;
			}
		}
		return null;
	}

	public static Subscription find(Message message, CallDialog dialog)
	{
		return find(makeId(message), dialog);
	}

	public static SubscriptionState state(Message message)
	{
		return SubscriptionStateParser.parse(message);
	}
}
