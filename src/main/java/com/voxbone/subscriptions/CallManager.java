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


import java.util.Hashtable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.log4j.Logger;

/**
 * Table of the running calls, each one owned by its {@link CallActor}
 *
 */
public class CallManager implements CallBridge
{
	private static Logger logger = Logger.getLogger(CallManager.class);

	private final Hashtable<String, CallActor> calls = new Hashtable<String, CallActor>();

	private final ServiceConfig config;
	private final ScheduledExecutorService scheduler;

	public CallManager(ServiceConfig config)
	{
		this.config = config;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory()
		{
			public Thread newThread(Runnable r)
			{
				Thread t = new Thread(r, "subscription-timers");
				t.setDaemon(true);
				return t;
			}
		});
	}

	public ServiceConfig getConfig()
	{
		return config;
	}

	/**
	 * Scheduler for the expiry timers; timer tasks must hand their work back to the call
	 */
	public ScheduledExecutorService getScheduler()
	{
		return scheduler;
	}

	private static String key(String serviceId, String callId)
	{
		return serviceId + "/" + callId;
	}

	/**
	 * Starts a call, or returns the one already running with that id
	 */
	public CallActor startCall(String serviceId, String callId) throws SubscriptionException
	{
		synchronized (calls)
		{
			CallActor actor = calls.get(key(serviceId, callId));
			if (actor != null)
			{
				return actor;
			}

			if (calls.size() >= config.getMaxCalls())
			{
				logger.warn("[[" + callId + "]] Too many calls (" + calls.size() + "), rejecting");
				throw new SubscriptionException("max_calls reached");
			}

			actor = new CallActor(new Call(serviceId, callId));
			calls.put(key(serviceId, callId), actor);
			logger.debug("[[" + callId + "]] Call started for " + serviceId);
			return actor;
		}
	}

	public boolean stopCall(String serviceId, String callId)
	{
		CallActor actor = calls.remove(key(serviceId, callId));
		if (actor == null)
		{
			return false;
		}
		actor.stop();
		return true;
	}

	public int getCallCount()
	{
		return calls.size();
	}

	/**
	 * Runs the function inside the call and waits for its result. Called from
	 * a function already running in that call, it is applied in place.
	 */
	public <T> T applyCall(String serviceId, String callId, CallFunction<T> fun) throws SubscriptionException
	{
		CallActor actor = calls.get(key(serviceId, callId));
		if (actor == null)
		{
			throw new CallNotFoundException("Call " + callId + " not found");
		}

		if (actor.isCurrentThread())
		{
			// waiting on our own queue would never finish
			return actor.applyInline(fun);
		}

		Future<T> future;
		try
		{
			future = actor.submit(fun);
		}
		catch (RejectedExecutionException e)
		{
			throw new CallNotFoundException("Call " + callId + " not found", e);
		}

		try
		{
			return future.get(config.getCallTimeout(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e)
		{
			future.cancel(false);
			logger.warn("[[" + callId + "]] No answer from call after " + config.getCallTimeout() + "ms");
			throw new CallNotFoundException("Call " + callId + " timed out", e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new CallNotFoundException("Interrupted waiting on call " + callId, e);
		}
		catch (ExecutionException e)
		{
			Throwable cause = e.getCause();
			if (cause instanceof SubscriptionException)
			{
				throw (SubscriptionException) cause;
			}
			if (cause instanceof RuntimeException)
			{
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error)
			{
				throw (Error) cause;
			}
			throw new SubscriptionException("Error in call " + callId, cause);
		}
	}

	public <T> T applyDialog(String serviceId, String callId, String dialogId, DialogFunction<T> fun) throws SubscriptionException
	{
		return applyCall(serviceId, callId, new DialogCallFunction<T>(dialogId, fun));
	}

	/**
	 * Queues the function for the dialog without waiting. Failures are only logged.
	 */
	public <T> void castDialog(String serviceId, final String callId, String dialogId, DialogFunction<T> fun)
	{
		CallActor actor = calls.get(key(serviceId, callId));
		if (actor == null)
		{
			logger.debug("[[" + callId + "]] Call is gone, dropping cast");
			return;
		}

		final DialogCallFunction<T> inner = new DialogCallFunction<T>(dialogId, fun);
		try
		{
			actor.submit(new CallFunction<T>()
			{
				public T apply(Call call)
				{
					try
					{
						return inner.apply(call);
					}
					catch (SubscriptionException e)
					{
						logger.debug("[[" + callId + "]] Cast not applied: " + e.getMessage());
					}
					catch (RuntimeException e)
					{
						logger.error("[[" + callId + "]] Error applying cast", e);
					}
					return null;
				}
			});
		}
		catch (RejectedExecutionException e)
		{
			logger.debug("[[" + callId + "]] Call is stopping, dropping cast");
		}
	}

	public void shutdown()
	{
		synchronized (calls)
		{
			for (CallActor actor : calls.values())
			{
				actor.stop();
			}
			calls.clear();
		}
		scheduler.shutdownNow();
	}

	private static class DialogCallFunction<T> implements CallFunction<T>
	{
		private final String dialogId;
		private final DialogFunction<T> fun;

		DialogCallFunction(String dialogId, DialogFunction<T> fun)
		{
			this.dialogId = dialogId;
			this.fun = fun;
		}

		public T apply(Call call) throws SubscriptionException
		{
			CallDialog dialog = call.getDialog(dialogId);
			if (dialog == null)
			{
				throw new CallNotFoundException("Dialog " + dialogId + " not found in call " + call.getCallId());
			}
			return fun.apply(dialog);
		}
	}
}
