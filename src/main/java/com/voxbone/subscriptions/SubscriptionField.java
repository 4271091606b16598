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
 * Fields readable from a subscription
 *
 */
public enum SubscriptionField
{
	ID("id"),
	INTERNAL_ID("internal_id"),
	STATUS("status"),
	EVENT("event"),
	RAW_EVENT("raw_event"),
	CLASS("class"),
	ANSWERED("answered"),
	EXPIRES("expires");

	private static final Map<String, SubscriptionField> byName = new HashMap<String, SubscriptionField>();

	static
	{
		for (SubscriptionField f : values())
		{
			byName.put(f.fieldName, f);
		}
	}

	private final String fieldName;

	private SubscriptionField(String fieldName)
	{
		this.fieldName = fieldName;
	}

	public String getFieldName()
	{
		return fieldName;
	}

	/**
	 * @return the field, or <code>null</code> when the name is not a subscription field
	 */
	public static SubscriptionField fromName(String name)
	{
		return byName.get(name);
	}
}
