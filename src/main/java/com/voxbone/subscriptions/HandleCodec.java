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


import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.StringUtils;

/**
 * Text form of the external handles.
 * <p>
 * A handle is a two character discriminator followed by the base64 of a
 * small binary tuple: one version byte, the arity, then every element as a
 * tag byte, an int length and that many UTF-8 bytes.
 * </p>
 */
final class HandleCodec
{
	static final String SUBSCRIPTION_PREFIX = "U_";
	static final String DIALOG_PREFIX = "D_";

	private static final int VERSION = 1;
	private static final int TAG_STRING = 's';

	private HandleCodec()
	{

	}

	static String encode(String prefix, String... elements)
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bytes);
		try
		{
			out.writeByte(VERSION);
			out.writeByte(elements.length);
			for (String element : elements)
			{
				if (element == null)
				{
					throw new IllegalArgumentException("Handle elements cannot be null");
				}
				byte [] utf8 = StringUtils.getBytesUtf8(element);
				out.writeByte(TAG_STRING);
				out.writeInt(utf8.length);
				out.write(utf8);
			}
			out.flush();
		}
		catch (IOException e)
		{
			// not thrown by an in-memory stream
			throw new IllegalStateException(e);
		}
		return prefix + Base64.encodeBase64String(bytes.toByteArray());
	}

	static String [] decode(String prefix, int arity, String handle) throws InvalidHandleException
	{
		if (handle == null || !handle.startsWith(prefix))
		{
			throw new InvalidHandleException(handle);
		}

		String payload = handle.substring(prefix.length());
		if (payload.length() == 0 || !isBase64(payload))
		{
			throw new InvalidHandleException(handle);
		}

		byte [] raw;
		try
		{
			raw = new Base64(0, new byte[0], false, CodecPolicy.STRICT).decode(payload);
		}
		catch (IllegalArgumentException e)
		{
			throw new InvalidHandleException(handle, e);
		}

		DataInputStream in = new DataInputStream(new ByteArrayInputStream(raw));
		try
		{
			if (in.readUnsignedByte() != VERSION || in.readUnsignedByte() != arity)
			{
				throw new InvalidHandleException(handle);
			}

			String [] elements = new String[arity];
			for (int i = 0; i < arity; i++)
			{
				if (in.readUnsignedByte() != TAG_STRING)
				{
					throw new InvalidHandleException(handle);
				}
				int length = in.readInt();
				if (length < 0 || length > in.available())
				{
					throw new InvalidHandleException(handle);
				}
				byte [] utf8 = new byte[length];
				in.readFully(utf8);
				elements[i] = StringUtils.newStringUtf8(utf8);
			}

			if (in.available() > 0)
			{
				throw new InvalidHandleException(handle);
			}
			return elements;
		}
		catch (IOException e)
		{
			throw new InvalidHandleException(handle, e);
		}
	}

	// commons-codec skips characters outside the alphabet instead of failing
	private static boolean isBase64(String text)
	{
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c > 127 || (c != '=' && !Base64.isBase64((byte) c)))
			{
				return false;
			}
		}
		return true;
	}
}
