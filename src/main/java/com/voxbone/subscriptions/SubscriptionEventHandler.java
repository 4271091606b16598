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


import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import javax.sip.header.CSeqHeader;
import javax.sip.header.EventHeader;
import javax.sip.header.ExpiresHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.apache.log4j.Logger;

/**
 * Keeps the subscriptions of a dialog in step with the SUBSCRIBE, REFER and
 * NOTIFY traffic going through it.
 * <p>
 * The methods must be called from the worker of the call owning the dialog,
 * after the message has been matched to that dialog. They return the
 * subscription the message applies to, or <code>null</code> if there is none,
 * leaving the answer to the caller (481 for an unknown NOTIFY, 400 for a bad
 * Subscription-State and so on).
 * </p>
 */
public class SubscriptionEventHandler
{
	private static Logger logger = Logger.getLogger(SubscriptionEventHandler.class);

	private final CallManager callManager;
	private final ServiceConfig config;

	public SubscriptionEventHandler(CallManager callManager)
	{
		this.callManager = callManager;
		this.config = callManager.getConfig();
	}

	public Subscription processRequest(CallDialog dialog, Request req)
	{
		String method = req.getMethod();
		logger.debug("[[" + dialog.getCallId() + "]] Got a request " + method);

		if (Request.SUBSCRIBE.equals(method))
		{
			return processSubscribe(dialog, req);
		}
		else if (Request.REFER.equals(method))
		{
			return processRefer(dialog, req);
		}
		else if (Request.NOTIFY.equals(method))
		{
			return processNotify(dialog, req);
		}
		return null;
	}

	public Subscription processResponse(CallDialog dialog, Response resp)
	{
		CSeqHeader cseq = (CSeqHeader) resp.getHeader(CSeqHeader.NAME);
		if (   cseq == null
		    || !(Request.SUBSCRIBE.equals(cseq.getMethod()) || Request.REFER.equals(cseq.getMethod())))
		{
			return null;
		}

		Subscription sub = Subscriptions.find(resp, dialog);
		if (sub == null || resp.getStatusCode() < 200)
		{
			return sub;
		}

		if (resp.getStatusCode() >= 300)
		{
			if (!sub.isAnswered())
			{
				logger.info("[[" + dialog.getCallId() + "]] " + cseq.getMethod() + " rejected with "
				          + resp.getStatusCode() + ", removing subscription " + sub.getId());
				sub.setStatus(SubscriptionState.terminated(null, null));
				dialog.removeSubscription(sub);
			}
			return sub;
		}

		ExpiresHeader expires = (ExpiresHeader) resp.getHeader(ExpiresHeader.NAME);
		if (expires != null && !sub.getStatus().isTerminated())
		{
			schedule(dialog, sub, expires.getExpires());
		}
		return sub;
	}

	private Subscription processSubscribe(CallDialog dialog, Request req)
	{
		EventHeader event = (EventHeader) req.getHeader(EventHeader.NAME);
		if (event == null)
		{
			logger.warn("[[" + dialog.getCallId() + "]] SUBSCRIBE without Event header");
			return null;
		}

		if (!config.isSupportedEvent(event.getEventType()))
		{
			logger.warn("[[" + dialog.getCallId() + "]] Unsupported event " + event.getEventType());
			return null;
		}

		ExpiresHeader expiresHeader = (ExpiresHeader) req.getHeader(ExpiresHeader.NAME);
		int expires = expiresHeader == null ? config.getEventExpires() : expiresHeader.getExpires();

		Subscription sub = Subscriptions.find(req, dialog);
		if (sub == null)
		{
			if (expires <= 0)
			{
				logger.debug("[[" + dialog.getCallId() + "]] Unsubscribe for unknown subscription");
				return null;
			}

			sub = new Subscription(Subscriptions.makeId(req), EventPackage.fromHeader(event),
			                       SubscriptionClass.SUBSCRIBE, SubscriptionState.pending(Integer.valueOf(expires)));
			dialog.addSubscription(sub);
			logger.info("[[" + dialog.getCallId() + "]] New subscription " + sub.getId() + " for " + sub.getEvent());
		}
		else
		{
			logger.debug("[[" + dialog.getCallId() + "]] Refresh subscribe for " + sub.getId() + ", expires " + expires);
		}

		schedule(dialog, sub, Math.max(0, expires));
		return sub;
	}

	private Subscription processRefer(CallDialog dialog, Request req)
	{
		CSeqHeader cseq = (CSeqHeader) req.getHeader(CSeqHeader.NAME);
		if (cseq == null)
		{
			return null;
		}

		Subscription sub = Subscriptions.find(req, dialog);
		if (sub == null)
		{
			sub = new Subscription(Subscriptions.makeId(req), EventPackage.refer(cseq.getSeqNumber()),
			                       SubscriptionClass.REFER, SubscriptionState.pending(null));
			dialog.addSubscription(sub);
			logger.info("[[" + dialog.getCallId() + "]] New refer subscription " + sub.getId());
			schedule(dialog, sub, config.getEventExpires());
		}
		return sub;
	}

	private Subscription processNotify(CallDialog dialog, Request req)
	{
		Subscription sub = Subscriptions.find(req, dialog);
		if (sub == null)
		{
			logger.debug("[[" + dialog.getCallId() + "]] NOTIFY for unknown subscription");
			return null;
		}

		SubscriptionState state = SubscriptionStateParser.parse(req);
		switch (state.getKind())
		{
			case ACTIVE:
			case PENDING:
				logger.debug("[[" + dialog.getCallId() + "]] Subscription " + sub.getId() + " is " + state);
				sub.setAnswered(true);
				sub.setStatus(state);
				if (state.getExpires() != null)
				{
					schedule(dialog, sub, state.getExpires().intValue());
				}
				break;

			case TERMINATED:
				logger.debug("[[" + dialog.getCallId() + "]] Subscription " + sub.getId() + " is over (" + state + "), removing");
				sub.setAnswered(true);
				sub.setStatus(state);
				dialog.removeSubscription(sub);
				break;

			default:
				logger.warn("[[" + dialog.getCallId() + "]] Invalid Subscription-State in NOTIFY for " + sub.getId());
				break;
		}
		return sub;
	}

	/**
	 * (Re)starts the expiry timer of the subscription. The timer hands the
	 * expiration back to the call, where it is dropped if the timer was
	 * replaced in between.
	 */
	void schedule(CallDialog dialog, Subscription sub, int seconds)
	{
		final String serviceId = dialog.getServiceId();
		final String callId = dialog.getCallId();
		final String dialogId = dialog.getId();
		final String subId = sub.getId();
		// setExpiryTimer below moves the subscription to this generation
		final long generation = sub.getTimerGeneration() + 1;

		ScheduledFuture<?> timer = callManager.getScheduler().schedule(new Runnable()
		{
			public void run()
			{
				callManager.castDialog(serviceId, callId, dialogId, new DialogFunction<Subscription>()
				{
					public Subscription apply(CallDialog d)
					{
						return expire(d, subId, generation);
					}
				});
			}
		}, (long) seconds + config.getEventExpiresOffset(), TimeUnit.SECONDS);

		sub.setExpiryTimer(timer);
	}

	Subscription expire(CallDialog dialog, String subId, long generation)
	{
		Subscription sub = Subscriptions.find(subId, dialog);
		if (sub == null)
		{
			return null;
		}

		if (sub.getTimerGeneration() != generation)
		{
			logger.debug("[[" + dialog.getCallId() + "]] Stale expiration for " + subId + ", ignoring");
			return sub;
		}

		logger.info("[[" + dialog.getCallId() + "]] Subscription " + subId + " expired");
		sub.setStatus(SubscriptionState.terminated(TerminationReason.TIMEOUT, null));
		dialog.removeSubscription(sub);
		return sub;
	}
}
