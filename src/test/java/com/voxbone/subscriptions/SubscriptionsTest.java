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


import javax.sip.message.Request;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionsTest
{
	private CallDialog dialog;
	private Subscription dialogSub;
	private Subscription presenceSub;

	@BeforeEach
	void setUp() throws Exception
	{
		dialog = new CallDialog("client", SipMessages.CALL_ID, SipMessages.FROM_TAG, SipMessages.TO_TAG);

		Request dialogSubscribe = SipMessages.request(Request.SUBSCRIBE, 1, "Event: dialog;id=abcd");
		Request presenceSubscribe = SipMessages.request(Request.SUBSCRIBE, 2, "Event: presence");

		dialogSub = new Subscription(Subscriptions.makeId(dialogSubscribe), new EventPackage("dialog"),
		                             SubscriptionClass.SUBSCRIBE, SubscriptionState.pending(null));
		presenceSub = new Subscription(Subscriptions.makeId(presenceSubscribe), new EventPackage("presence"),
		                               SubscriptionClass.SUBSCRIBE, SubscriptionState.pending(null));
		dialog.addSubscription(dialogSub);
		dialog.addSubscription(presenceSub);
	}

	@Test
	void shouldFindByMessage() throws Exception
	{
		Request notify = SipMessages.request(Request.NOTIFY, 10, "Event: presence", "Subscription-State: active");

		assertSame(presenceSub, Subscriptions.find(notify, dialog));
	}

	@Test
	void shouldFindById()
	{
		assertSame(dialogSub, Subscriptions.find(dialogSub.getId(), dialog));
		assertNull(Subscriptions.find("missing", dialog));
	}

	@Test
	void shouldNotFindUnknownEvent() throws Exception
	{
		Request notify = SipMessages.request(Request.NOTIFY, 10, "Event: dialog;id=other", "Subscription-State: active");

		assertNull(Subscriptions.find(notify, dialog));
	}

	@Test
	void shouldRefuseDuplicatedIds()
	{
		Subscription again = new Subscription(dialogSub.getId(), new EventPackage("dialog"),
		                                      SubscriptionClass.SUBSCRIBE, SubscriptionState.pending(null));

		assertThrows(IllegalStateException.class, () -> dialog.addSubscription(again));
	}

	@Test
	void shouldBuildHandleFromLiveSubscription() throws Exception
	{
		String handle = Subscriptions.getHandle(new SubscriptionRef(presenceSub, dialog));

		SubscriptionHandle parsed = Subscriptions.parseHandle(handle);
		assertEquals("client", parsed.getServiceId());
		assertEquals(presenceSub.getId(), parsed.getSubscriptionId());
		assertEquals(dialog.getId(), parsed.getDialogId());
		assertEquals(SipMessages.CALL_ID, parsed.getCallId());
	}

	@Test
	void shouldBuildSameHandleFromMessage() throws Exception
	{
		Request notify = SipMessages.request(Request.NOTIFY, 10, "Event: presence", "Subscription-State: active");

		assertEquals(Subscriptions.getHandle(new SubscriptionRef(presenceSub, dialog)),
		             Subscriptions.getHandle(notify, "client", dialog.getId()));
	}

	@Test
	void shouldBuildHandleFromMessageRef() throws Exception
	{
		Request notify = SipMessages.request(Request.NOTIFY, 10, "Event: presence", "Subscription-State: active");

		assertEquals(Subscriptions.getHandle(new SubscriptionRef(presenceSub, dialog)),
		             Subscriptions.getHandle(new MessageRef(notify, "client", dialog.getId())));
	}

	@Test
	void shouldRejectBareMessages() throws Exception
	{
		Request notify = SipMessages.request(Request.NOTIFY, 10, "Event: presence", "Subscription-State: active");

		assertThrows(InvalidSubscriptionException.class, () -> Subscriptions.getHandle((Object) notify));
		assertThrows(InvalidSubscriptionException.class,
		        () -> Subscriptions.getHandle(new MessageRef(notify, null, dialog.getId())));
	}

	@Test
	void shouldPassHandlesThrough() throws Exception
	{
		String handle = new SubscriptionHandle("s", "u", "d", "c").encode();

		assertSame(handle, Subscriptions.getHandle(handle));
	}

	@Test
	void shouldRejectAnythingElse()
	{
		assertThrows(InvalidSubscriptionException.class, () -> Subscriptions.getHandle("D_abc"));
		assertThrows(InvalidSubscriptionException.class, () -> Subscriptions.getHandle(Integer.valueOf(3)));
		assertThrows(InvalidSubscriptionException.class, () -> Subscriptions.getHandle((Object) null));
		assertThrows(InvalidSubscriptionException.class, () -> Subscriptions.getHandle(dialog));
	}

	@Test
	void shouldGiveThePeerTheSwappedDialogId()
	{
		CallDialog peer = new CallDialog("server", SipMessages.CALL_ID, SipMessages.TO_TAG, SipMessages.FROM_TAG);

		assertEquals(peer.getId(), dialog.getRemoteId());
		assertEquals(dialog.getId(), peer.getRemoteId());
		assertNotEquals(dialog.getId(), peer.getId());
	}
}
