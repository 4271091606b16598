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
import java.util.List;

/**
 * Dialog level field values
 *
 */
public final class DialogMeta
{
	private DialogMeta()
	{

	}

	public static Object getMeta(String field, CallDialog dialog) throws InvalidFieldException
	{
		DialogField f = DialogField.fromName(field);
		if (f == null)
		{
			throw new InvalidFieldException(field);
		}

		switch (f)
		{
			case ID:
				return dialog.getHandle().encode();
			case INTERNAL_ID:
				return dialog.getId();
			case SRV_ID:
				return dialog.getServiceId();
			case CALL_ID:
				return dialog.getCallId();
			case LOCAL_TAG:
				return dialog.getLocalTag();
			case REMOTE_TAG:
				return dialog.getRemoteTag();
			case LOCAL_URI:
				return dialog.getLocalUri();
			case REMOTE_URI:
				return dialog.getRemoteUri();
			case LOCAL_TARGET:
				return dialog.getLocalTarget();
			case REMOTE_TARGET:
				return dialog.getRemoteTarget();
			case LOCAL_SEQ:
				return Long.valueOf(dialog.getLocalSeq());
			case REMOTE_SEQ:
				return Long.valueOf(dialog.getRemoteSeq());
			case CREATED:
				return Long.valueOf(dialog.getCreated());
			case UPDATED:
				return Long.valueOf(dialog.getUpdated());
			case SUBSCRIPTIONS:
				List<String> handles = new ArrayList<String>();
				for (Subscription sub : dialog.getSubscriptions())
				{
					handles.add(Subscriptions.makeHandle(sub, dialog).encode());
				}
				return handles;
			default:
				throw new InvalidFieldException(field);
		}
	}
}
