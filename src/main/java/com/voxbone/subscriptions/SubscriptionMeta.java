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
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reads named fields of a subscription. Names that are not subscription
 * fields are read from the owning dialog.
 *
 */
public final class SubscriptionMeta
{
	private SubscriptionMeta()
	{

	}

	public static Object getMeta(String field, Subscription subscription, CallDialog dialog) throws InvalidFieldException
	{
		SubscriptionField f = SubscriptionField.fromName(field);
		if (f == null)
		{
			return DialogMeta.getMeta(field, dialog);
		}

		switch (f)
		{
			case ID:
				return Subscriptions.makeHandle(subscription, dialog).encode();
			case INTERNAL_ID:
				return subscription.getId();
			case STATUS:
				return subscription.getStatus();
			case EVENT:
				return subscription.getEvent();
			case RAW_EVENT:
				return subscription.getEvent().toRawString();
			case CLASS:
				return subscription.getSubscriptionClass();
			case ANSWERED:
				return Boolean.valueOf(subscription.isAnswered());
			case EXPIRES:
				return remainingSeconds(subscription.getExpiryTimer());
			default:
				return DialogMeta.getMeta(field, dialog);
		}
	}

	public static Object getMeta(String field, SubscriptionRef ref) throws InvalidFieldException
	{
		return getMeta(field, ref.getSubscription(), ref.getDialog());
	}

	/**
	 * Values for every name, in the given order. Repeated names give repeated entries.
	 */
	public static List<FieldValue> getMetas(List<String> fields, Subscription subscription, CallDialog dialog) throws InvalidFieldException
	{
		List<FieldValue> values = new ArrayList<FieldValue>(fields.size());
		for (String field : fields)
		{
			values.add(new FieldValue(field, getMeta(field, subscription, dialog)));
		}
		return values;
	}

	public static List<FieldValue> getMetas(List<String> fields, SubscriptionRef ref) throws InvalidFieldException
	{
		return getMetas(fields, ref.getSubscription(), ref.getDialog());
	}

	static Integer remainingSeconds(ScheduledFuture<?> timer)
	{
		if (timer == null || timer.isDone())
		{
			return null;
		}
		long millis = timer.getDelay(TimeUnit.MILLISECONDS);
		return Integer.valueOf((int) Math.max(0, Math.round(millis / 1000.0)));
	}
}
