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
import java.util.List;

/**
 * Operations on subscriptions that live inside running calls, addressed by handle
 *
 */
public class SubscriptionManager
{
	private final CallBridge bridge;
	private final DialogLayer dialogLayer;

	public SubscriptionManager(CallBridge bridge, DialogLayer dialogLayer)
	{
		this.bridge = bridge;
		this.dialogLayer = dialogLayer;
	}

	public SubscriptionManager(CallBridge bridge)
	{
		this(bridge, new CallDialogLayer(bridge));
	}

	public Object remoteMeta(String field, String handle) throws SubscriptionException
	{
		return remoteMetas(Collections.singletonList(field), handle).get(0).getValue();
	}

	/**
	 * Reads fields of the subscription from the call holding it.
	 *
	 * @throws InvalidHandleException if the handle cannot be decoded
	 * @throws InvalidSubscriptionException if the dialog no longer has the subscription
	 * @throws InvalidFieldException if a field is unknown
	 * @throws CallNotFoundException if the call or dialog is gone
	 */
	public List<FieldValue> remoteMetas(final List<String> fields, String handle) throws SubscriptionException
	{
		final SubscriptionHandle h = SubscriptionHandle.parse(handle);

		return bridge.applyDialog(h.getServiceId(), h.getCallId(), h.getDialogId(),
			new DialogFunction<List<FieldValue>>()
			{
				public List<FieldValue> apply(CallDialog dialog) throws SubscriptionException
				{
					Subscription sub = Subscriptions.find(h.getSubscriptionId(), dialog);
					if (sub == null)
					{
						throw new InvalidSubscriptionException(h.getSubscriptionId());
					}
					return SubscriptionMeta.getMetas(fields, sub, dialog);
				}
			});
	}

	/**
	 * Handle of the same subscription as seen from the other end of the dialog.
	 * Only the dialog part changes: the subscription id comes from the messages
	 * and is the same on both sides.
	 */
	public String remoteId(String handle, String remoteServiceId) throws SubscriptionException
	{
		SubscriptionHandle h = SubscriptionHandle.parse(handle);
		DialogHandle remote = dialogLayer.remoteId(h.getDialogHandle(), remoteServiceId);
		return new SubscriptionHandle(remote.getServiceId(), h.getSubscriptionId(), remote.getDialogId(), remote.getCallId()).encode();
	}

	/**
	 * Same as {@link #remoteId(String, String)} with the peer in the same service
	 */
	public String remoteId(String handle) throws SubscriptionException
	{
		return remoteId(handle, SubscriptionHandle.parse(handle).getServiceId());
	}
}
