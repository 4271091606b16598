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


import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallManagerTest
{
	private CallManager manager;
	private CallDialog dialog;

	@BeforeEach
	void setUp() throws Exception
	{
		Properties props = new Properties();
		props.setProperty(ServiceConfig.CALL_TIMEOUT, "200");
		props.setProperty(ServiceConfig.MAX_CALLS, "2");
		manager = new CallManager(new ServiceConfig(props));

		dialog = new CallDialog("srv", "call-1", "tag-a", "tag-b");
		manager.startCall("srv", "call-1");
		manager.applyCall("srv", "call-1", call -> {
			call.addDialog(dialog);
			return null;
		});
	}

	@AfterEach
	void tearDown()
	{
		manager.shutdown();
	}

	@Test
	void shouldApplyFunctionToDialog() throws Exception
	{
		String callId = manager.applyDialog("srv", "call-1", dialog.getId(), d -> d.getCallId());

		assertEquals("call-1", callId);
	}

	@Test
	void shouldRunInCallThread() throws Exception
	{
		String name = manager.applyDialog("srv", "call-1", dialog.getId(), d -> Thread.currentThread().getName());

		assertEquals("call-srv-call-1", name);
	}

	@Test
	void shouldApplyNestedFunctionInPlace() throws Exception
	{
		String callId = manager.applyDialog("srv", "call-1", dialog.getId(),
		        d -> manager.applyDialog("srv", "call-1", dialog.getId(), inner -> inner.getCallId()));

		assertEquals("call-1", callId);
	}

	@Test
	void shouldFailForMissingCall()
	{
		assertThrows(CallNotFoundException.class,
		        () -> manager.applyDialog("srv", "call-2", dialog.getId(), d -> d));
		assertThrows(CallNotFoundException.class,
		        () -> manager.applyDialog("other", "call-1", dialog.getId(), d -> d));
	}

	@Test
	void shouldFailForMissingDialog()
	{
		assertThrows(CallNotFoundException.class,
		        () -> manager.applyDialog("srv", "call-1", "no-such-dialog", d -> d));
	}

	@Test
	void shouldPropagateFunctionErrors()
	{
		InvalidFieldException e = assertThrows(InvalidFieldException.class,
		        () -> manager.applyDialog("srv", "call-1", dialog.getId(), d -> {
		            throw new InvalidFieldException("colour");
		        }));
		assertEquals("colour", e.getField());

		assertThrows(IllegalStateException.class,
		        () -> manager.applyDialog("srv", "call-1", dialog.getId(), d -> {
		            throw new IllegalStateException("broken");
		        }));
	}

	@Test
	void shouldTimeOutOnBusyCall() throws Exception
	{
		final CountDownLatch release = new CountDownLatch(1);
		try
		{
			assertThrows(CallNotFoundException.class,
			        () -> manager.applyDialog("srv", "call-1", dialog.getId(), d -> await(release)));
		}
		finally
		{
			release.countDown();
		}

		// the call is still usable afterwards
		assertEquals("call-1", manager.applyDialog("srv", "call-1", dialog.getId(), d -> d.getCallId()));
	}

	private static boolean await(CountDownLatch latch)
	{
		try
		{
			return latch.await(5, TimeUnit.SECONDS);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			return false;
		}
	}

	@Test
	void shouldLimitCalls() throws Exception
	{
		CallActor second = manager.startCall("srv", "call-2");

		assertSame(second, manager.startCall("srv", "call-2"));
		assertThrows(SubscriptionException.class, () -> manager.startCall("srv", "call-3"));
		assertEquals(2, manager.getCallCount());

		assertTrue(manager.stopCall("srv", "call-2"));
		assertNotNull(manager.startCall("srv", "call-3"));
	}

	@Test
	void shouldNotReachStoppedCalls() throws Exception
	{
		Subscription sub = new Subscription("sub-1", new EventPackage("presence"),
		                                    SubscriptionClass.SUBSCRIBE, SubscriptionState.pending(null));
		dialog.addSubscription(sub);

		assertTrue(manager.stopCall("srv", "call-1"));
		assertFalse(manager.stopCall("srv", "call-1"));

		assertThrows(CallNotFoundException.class,
		        () -> manager.applyDialog("srv", "call-1", dialog.getId(), d -> d));
	}

	@Test
	void shouldRejectWorkOnStoppingActor() throws Exception
	{
		CallActor actor = manager.startCall("srv", "call-1");
		actor.stop();

		assertTrue(actor.isStopped());
		assertThrows(CallNotFoundException.class,
		        () -> manager.applyDialog("srv", "call-1", dialog.getId(), d -> d));
	}

	@Test
	void shouldCastWithoutWaiting() throws Exception
	{
		final AtomicBoolean applied = new AtomicBoolean();

		manager.castDialog("srv", "call-1", dialog.getId(), d -> {
			applied.set(true);
			return null;
		});
		// the call applies its work in order, so this runs after the cast
		manager.applyDialog("srv", "call-1", dialog.getId(), d -> d);

		assertTrue(applied.get());
	}

	@Test
	void shouldDropCastsToMissingTargets() throws Exception
	{
		manager.castDialog("srv", "call-9", dialog.getId(), d -> {
			throw new IllegalStateException("never applied");
		});
		manager.castDialog("srv", "call-1", "no-such-dialog", d -> {
			throw new IllegalStateException("never applied");
		});

		assertEquals("call-1", manager.applyDialog("srv", "call-1", dialog.getId(), d -> d.getCallId()));
	}
}
