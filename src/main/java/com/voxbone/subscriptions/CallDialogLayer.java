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


import org.apache.log4j.Logger;

/**
 * {@link DialogLayer} reading the dialogs through their calls
 *
 */
public class CallDialogLayer implements DialogLayer
{
	private static Logger logger = Logger.getLogger(CallDialogLayer.class);

	private final CallBridge bridge;

	public CallDialogLayer(CallBridge bridge)
	{
		this.bridge = bridge;
	}

	public DialogHandle remoteId(DialogHandle handle, String remoteServiceId) throws SubscriptionException
	{
		String remoteDialogId = bridge.applyDialog(handle.getServiceId(), handle.getCallId(), handle.getDialogId(),
			new DialogFunction<String>()
			{
				public String apply(CallDialog dialog)
				{
					return dialog.getRemoteId();
				}
			});

		logger.debug("[[" + handle.getCallId() + "]] Remote dialog of " + handle.getDialogId() + " is " + remoteDialogId);
		return new DialogHandle(remoteServiceId, remoteDialogId, handle.getCallId());
	}
}
