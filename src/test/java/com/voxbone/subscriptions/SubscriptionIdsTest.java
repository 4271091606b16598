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


import java.util.Arrays;

import javax.sip.message.Request;
import javax.sip.message.Response;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionIdsTest
{
	@Test
	void shouldGiveReferAndItsResponseTheSameId() throws Exception
	{
		Request refer = SipMessages.request(Request.REFER, 7, "Refer-To: <sip:carol@example.com>");
		Response accepted = SipMessages.response(202, "Accepted", Request.REFER, 7);

		assertEquals(SubscriptionIds.makeId(refer), SubscriptionIds.makeId(accepted));
	}

	@Test
	void shouldMatchReferNotifyWithTheRefer() throws Exception
	{
		Request refer = SipMessages.request(Request.REFER, 7, "Refer-To: <sip:carol@example.com>");
		Request notify = SipMessages.request(Request.NOTIFY, 20, "Event: refer;id=7", "Subscription-State: active");

		assertEquals(SubscriptionIds.makeId(refer), SubscriptionIds.makeId(notify));
	}

	@Test
	void shouldSeparateRefersByCSeq() throws Exception
	{
		Request first = SipMessages.request(Request.REFER, 7);
		Request second = SipMessages.request(Request.REFER, 8);

		assertNotEquals(SubscriptionIds.makeId(first), SubscriptionIds.makeId(second));
	}

	@Test
	void shouldUseEventTypeAndId() throws Exception
	{
		Request subscribe = SipMessages.request(Request.SUBSCRIBE, 1, "Event: dialog;id=abcd", "Expires: 3600");
		Request notify = SipMessages.request(Request.NOTIFY, 2, "Event: dialog;id=abcd", "Subscription-State: active");
		Request otherId = SipMessages.request(Request.NOTIFY, 3, "Event: dialog;id=efgh", "Subscription-State: active");
		Request otherEvent = SipMessages.request(Request.NOTIFY, 4, "Event: presence;id=abcd", "Subscription-State: active");

		assertEquals(SubscriptionIds.makeId(subscribe), SubscriptionIds.makeId(notify));
		assertNotEquals(SubscriptionIds.makeId(subscribe), SubscriptionIds.makeId(otherId));
		assertNotEquals(SubscriptionIds.makeId(subscribe), SubscriptionIds.makeId(otherEvent));
	}

	@Test
	void shouldIgnoreCSeqOfSubscribeResponses() throws Exception
	{
		Request subscribe = SipMessages.request(Request.SUBSCRIBE, 1, "Event: presence", "Expires: 60");
		Response ok = SipMessages.response(200, "OK", Request.SUBSCRIBE, 1, "Event: presence", "Expires: 60");
		Request refresh = SipMessages.request(Request.SUBSCRIBE, 2, "Event: presence", "Expires: 60");

		assertEquals(SubscriptionIds.makeId(subscribe), SubscriptionIds.makeId(ok));
		assertEquals(SubscriptionIds.makeId(subscribe), SubscriptionIds.makeId(refresh));
	}

	@Test
	void shouldReturnSentinelWithoutEvent() throws Exception
	{
		Request options = SipMessages.request(Request.OPTIONS, 1);

		assertEquals(SubscriptionIds.NO_EVENT_ID, SubscriptionIds.makeId(options));
	}

	@Test
	void shouldHashLongValues()
	{
		char [] chars = new char[70000];
		Arrays.fill(chars, 'x');
		String longId = new String(chars);

		assertEquals(SubscriptionIds.hash("dialog", longId), SubscriptionIds.hash("dialog", longId));
		assertNotEquals(SubscriptionIds.hash("dialog", longId), SubscriptionIds.hash("dialog", longId.substring(1)));
	}

	@Test
	void shouldTellMissingFromEmpty()
	{
		assertNotEquals(SubscriptionIds.hash("dialog", null), SubscriptionIds.hash("dialog", ""));
		assertNotEquals(SubscriptionIds.hash("ab", "c"), SubscriptionIds.hash("a", "bc"));
		assertEquals(SubscriptionIds.hash("dialog", "x"), SubscriptionIds.hash("dialog", "x"));
	}
}
