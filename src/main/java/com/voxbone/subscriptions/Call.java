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


import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one call: its dialogs, keyed by dialog id.
 * Only the worker of the owning {@link CallActor} reads or changes it.
 *
 */
public class Call
{
	private final String serviceId;
	private final String callId;
	private final Map<String, CallDialog> dialogs = new LinkedHashMap<String, CallDialog>();

	public Call(String serviceId, String callId)
	{
		this.serviceId = serviceId;
		this.callId = callId;
	}

	public String getServiceId()
	{
		return serviceId;
	}

	public String getCallId()
	{
		return callId;
	}

	public void addDialog(CallDialog dialog)
	{
		if (!callId.equals(dialog.getCallId()) || !serviceId.equals(dialog.getServiceId()))
		{
			throw new IllegalArgumentException("Dialog " + dialog + " does not belong to call " + callId);
		}
		dialogs.put(dialog.getId(), dialog);
	}

	public CallDialog getDialog(String dialogId)
	{
		return dialogs.get(dialogId);
	}

	public CallDialog removeDialog(String dialogId)
	{
		CallDialog dialog = dialogs.remove(dialogId);
		if (dialog != null)
		{
			dialog.cancelSubscriptions();
		}
		return dialog;
	}

	public List<CallDialog> getDialogs()
	{
		return new ArrayList<CallDialog>(dialogs.values());
	}

	void close()
	{
		for (CallDialog dialog : dialogs.values())
		{
			dialog.cancelSubscriptions();
		}
		dialogs.clear();
	}
}
