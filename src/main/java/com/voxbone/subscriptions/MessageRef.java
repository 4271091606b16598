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


import javax.sip.message.Message;

/**
 * A SIP message together with the service and dialog it was received in
 *
 */
public final class MessageRef
{
	private final Message message;
	private final String serviceId;
	private final String dialogId;

	public MessageRef(Message message, String serviceId, String dialogId)
	{
		this.message = message;
		this.serviceId = serviceId;
		this.dialogId = dialogId;
	}

	public Message getMessage()
	{
		return message;
	}

	public String getServiceId()
	{
		return serviceId;
	}

	public String getDialogId()
	{
		return dialogId;
	}
}
