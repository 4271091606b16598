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


import java.util.HashMap;
import java.util.Map;

/**
 * Fields readable from a dialog
 *
 */
public enum DialogField
{
	ID("id"),
	INTERNAL_ID("internal_id"),
	SRV_ID("srv_id"),
	CALL_ID("call_id"),
	LOCAL_TAG("local_tag"),
	REMOTE_TAG("remote_tag"),
	LOCAL_URI("local_uri"),
	REMOTE_URI("remote_uri"),
	LOCAL_TARGET("local_target"),
	REMOTE_TARGET("remote_target"),
	LOCAL_SEQ("local_seq"),
	REMOTE_SEQ("remote_seq"),
	CREATED("created"),
	UPDATED("updated"),
	SUBSCRIPTIONS("subscriptions");

	private static final Map<String, DialogField> byName = new HashMap<String, DialogField>();

	static
	{
		for (DialogField f : values())
		{
			byName.put(f.fieldName, f);
		}
	}

	private final String fieldName;

	private DialogField(String fieldName)
	{
		this.fieldName = fieldName;
	}

	public String getFieldName()
	{
		return fieldName;
	}

	public static DialogField fromName(String name)
	{
		return byName.get(name);
	}
}
