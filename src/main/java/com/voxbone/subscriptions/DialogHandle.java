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
 * Portable reference to a dialog (<code>D_</code> handle)
 *
 */
public final class DialogHandle
{
	private final String serviceId;
	private final String dialogId;
	private final String callId;

	public DialogHandle(String serviceId, String dialogId, String callId)
	{
		if (serviceId == null || dialogId == null || callId == null)
		{
			throw new IllegalArgumentException("Handle elements cannot be null");
		}
		this.serviceId = serviceId;
		this.dialogId = dialogId;
		this.callId = callId;
	}

	public static DialogHandle parse(String handle) throws InvalidHandleException
	{
		String [] e = HandleCodec.decode(HandleCodec.DIALOG_PREFIX, 3, handle);
		return new DialogHandle(e[0], e[1], e[2]);
	}

	public String encode()
	{
		return HandleCodec.encode(HandleCodec.DIALOG_PREFIX, serviceId, dialogId, callId);
	}

	public String getServiceId()
	{
		return serviceId;
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
		if (!(o instanceof DialogHandle))
		{
			return false;
		}
		DialogHandle other = (DialogHandle) o;
		return serviceId.equals(other.serviceId)
		    && dialogId.equals(other.dialogId)
		    && callId.equals(other.callId);
	}

	@Override
	public int hashCode()
	{
		return 31 * (31 * serviceId.hashCode() + dialogId.hashCode()) + callId.hashCode();
	}

	@Override
	public String toString()
	{
		return encode();
	}
}
