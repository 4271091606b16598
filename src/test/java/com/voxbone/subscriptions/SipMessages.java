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


import java.text.ParseException;

import javax.sip.PeerUnavailableException;
import javax.sip.SipFactory;
import javax.sip.message.MessageFactory;
import javax.sip.message.Request;
import javax.sip.message.Response;

/**
 * Builds JAIN-SIP messages from raw text for the tests
 *
 */
final class SipMessages
{
	static final String CALL_ID = "a84b4c76e66710@10.0.0.1";
	static final String FROM_TAG = "1928301774";
	static final String TO_TAG = "a6c85cf";

	private static MessageFactory messageFactory;

	static
	{
		SipFactory sipFactory = SipFactory.getInstance();
		sipFactory.setPathName("gov.nist");
		try
		{
			messageFactory = sipFactory.createMessageFactory();
		}
		catch (PeerUnavailableException e)
		{
			throw new IllegalStateException(e);
		}
	}

	private SipMessages()
	{

	}

	static Request request(String method, long cseq, String... extraHeaders) throws ParseException
	{
		StringBuilder sb = new StringBuilder();
		sb.append(method).append(" sip:bob@example.com SIP/2.0\r\n");
		sb.append("Via: SIP/2.0/UDP 10.0.0.1:5060;branch=z9hG4bK776asdhds").append(cseq).append("\r\n");
		sb.append("Max-Forwards: 70\r\n");
		sb.append("From: <sip:alice@example.com>;tag=").append(FROM_TAG).append("\r\n");
		sb.append("To: <sip:bob@example.com>;tag=").append(TO_TAG).append("\r\n");
		sb.append("Call-ID: ").append(CALL_ID).append("\r\n");
		sb.append("CSeq: ").append(cseq).append(' ').append(method).append("\r\n");
		for (String header : extraHeaders)
		{
			sb.append(header).append("\r\n");
		}
		sb.append("Content-Length: 0\r\n\r\n");
		return messageFactory.createRequest(sb.toString());
	}

	static Response response(int code, String reason, String method, long cseq, String... extraHeaders) throws ParseException
	{
		StringBuilder sb = new StringBuilder();
		sb.append("SIP/2.0 ").append(code).append(' ').append(reason).append("\r\n");
		sb.append("Via: SIP/2.0/UDP 10.0.0.1:5060;branch=z9hG4bK776asdhds").append(cseq).append("\r\n");
		sb.append("From: <sip:alice@example.com>;tag=").append(FROM_TAG).append("\r\n");
		sb.append("To: <sip:bob@example.com>;tag=").append(TO_TAG).append("\r\n");
		sb.append("Call-ID: ").append(CALL_ID).append("\r\n");
		sb.append("CSeq: ").append(cseq).append(' ').append(method).append("\r\n");
		for (String header : extraHeaders)
		{
			sb.append(header).append("\r\n");
		}
		sb.append("Content-Length: 0\r\n\r\n");
		return messageFactory.createResponse(sb.toString());
	}
}
