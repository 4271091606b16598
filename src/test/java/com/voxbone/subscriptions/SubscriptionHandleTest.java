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


import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.util.Arrays;

import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionHandleTest
{
	@Test
	void shouldDecodeWhatWasEncoded()
	{
		SubscriptionHandle handle = new SubscriptionHandle("client", "sub-1", "dlg-1", "call@host");

		String text = handle.encode();

		assertTrue(text.startsWith("U_"));
		assertEquals(handle, assertDoesNotThrow(() -> SubscriptionHandle.parse(text)));
	}

	@Test
	void shouldKeepNonAsciiAndSeparatorCharacters() throws Exception
	{
		SubscriptionHandle handle = new SubscriptionHandle("srv_é", "a_b_c", "", "U_x;y=z");

		SubscriptionHandle parsed = SubscriptionHandle.parse(handle.encode());

		assertEquals("srv_é", parsed.getServiceId());
		assertEquals("a_b_c", parsed.getSubscriptionId());
		assertEquals("", parsed.getDialogId());
		assertEquals("U_x;y=z", parsed.getCallId());
	}

	@Test
	void shouldKeepLongElements() throws Exception
	{
		char [] chars = new char[70000];
		Arrays.fill(chars, 'x');
		String callId = new String(chars);

		SubscriptionHandle parsed = SubscriptionHandle.parse(new SubscriptionHandle("s", "u", "d", callId).encode());

		assertEquals(callId, parsed.getCallId());
		assertEquals("d", parsed.getDialogId());
	}

	@Test
	void shouldRejectLengthBeyondPayload() throws Exception
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bytes);
		out.writeByte(1);
		out.writeByte(4);
		out.writeByte('s');
		out.writeInt(1000);
		out.write(new byte[] { 'a', 'b' });
		out.flush();

		assertThrows(InvalidHandleException.class,
		        () -> SubscriptionHandle.parse("U_" + Base64.encodeBase64String(bytes.toByteArray())));
	}

	@Test
	void shouldRejectWrongPrefix()
	{
		String payload = new SubscriptionHandle("s", "u", "d", "c").encode().substring(2);

		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("D_" + payload));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("u_" + payload));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse(payload));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse(""));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse(null));
	}

	@Test
	void shouldRejectUndecodablePayload()
	{
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("U_"));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("U_not base64!"));
		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("U_" + Base64.encodeBase64String("hello".getBytes())));
	}

	@Test
	void shouldRejectPayloadOfAnotherArity()
	{
		String dialogPayload = new DialogHandle("s", "d", "c").encode().substring(2);

		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("U_" + dialogPayload));
	}

	@Test
	void shouldRejectTrailingBytes()
	{
		byte [] raw = Base64.decodeBase64(new SubscriptionHandle("s", "u", "d", "c").encode().substring(2));
		byte [] longer = new byte[raw.length + 1];
		System.arraycopy(raw, 0, longer, 0, raw.length);

		assertThrows(InvalidHandleException.class, () -> SubscriptionHandle.parse("U_" + Base64.encodeBase64String(longer)));
	}

	@Test
	void shouldGiveTheDialogHandle() throws Exception
	{
		SubscriptionHandle handle = new SubscriptionHandle("s", "u", "d", "c");

		DialogHandle dialog = DialogHandle.parse(handle.getDialogHandle().encode());

		assertTrue(handle.getDialogHandle().encode().startsWith("D_"));
		assertEquals(new DialogHandle("s", "d", "c"), dialog);
	}

	@Test
	void shouldNotAcceptNullElements()
	{
		assertThrows(IllegalArgumentException.class, () -> new SubscriptionHandle("s", null, "d", "c"));
	}
}
