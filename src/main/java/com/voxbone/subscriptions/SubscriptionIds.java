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
import java.io.IOException;

import javax.sip.header.CSeqHeader;
import javax.sip.header.EventHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.StringUtils;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Derives subscription identities from SIP messages.
 * <p>
 * A REFER, and every response to it, maps to <code>hash("refer", cseq)</code>.
 * The NOTIFYs of the implicit subscription carry <code>Event: refer;id=cseq</code>
 * and so hash the same pair. Any other message hashes its event package and
 * the <code>id</code> parameter of its Event header.
 * </p>
 */
public final class SubscriptionIds
{
	/** Identity of messages without an Event header */
	public static final String NO_EVENT_ID = "id";

	static final String REFER_EVENT = "refer";

	private static final int ID_BYTES = 15;

	private SubscriptionIds()
	{

	}

	public static String makeId(Message message)
	{
		CSeqHeader cseq = (CSeqHeader) message.getHeader(CSeqHeader.NAME);

		if (cseq != null && Request.REFER.equals(cseq.getMethod()))
		{
			if (   message instanceof Response
			    || (message instanceof Request && Request.REFER.equals(((Request) message).getMethod())))
			{
				return hash(REFER_EVENT, Long.toString(cseq.getSeqNumber()));
			}
		}

		EventHeader event = (EventHeader) message.getHeader(EventHeader.NAME);
		if (event == null)
		{
			return NO_EVENT_ID;
		}
		return hash(event.getEventType(), event.getEventId());
	}

	/**
	 * Stable digest over an ordered list of values, <code>null</code> being
	 * distinct from the empty string.
	 */
	public static String hash(String... values)
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		DataOutputStream out = new DataOutputStream(bytes);
		try
		{
			out.writeInt(values.length);
			for (String value : values)
			{
				if (value == null)
				{
					out.writeByte(0);
				}
				else
				{
					byte [] utf8 = StringUtils.getBytesUtf8(value);
					out.writeByte(1);
					out.writeInt(utf8.length);
					out.write(utf8);
				}
			}
			out.flush();
		}
		catch (IOException e)
		{
			// not thrown by an in-memory stream
			throw new IllegalStateException(e);
		}

		byte [] digest = DigestUtils.sha1(bytes.toByteArray());
		byte [] id = new byte[ID_BYTES];
		System.arraycopy(digest, 0, id, 0, ID_BYTES);
		return Base64.encodeBase64URLSafeString(id);
	}
}
