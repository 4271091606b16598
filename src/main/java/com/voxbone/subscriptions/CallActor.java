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


import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

import org.apache.log4j.Logger;

/**
 * Owner of a {@link Call}: a single thread applying, in order, everything
 * submitted for the call.
 *
 */
public class CallActor
{
	private static Logger logger = Logger.getLogger(CallActor.class);

	private final Call call;
	private final ExecutorService worker;
	private volatile Thread workerThread;

	public CallActor(final Call call)
	{
		this.call = call;
		this.worker = Executors.newSingleThreadExecutor(new ThreadFactory()
		{
			public Thread newThread(Runnable r)
			{
				Thread t = new Thread(r, "call-" + call.getServiceId() + "-" + call.getCallId());
				t.setDaemon(true);
				workerThread = t;
				return t;
			}
		});
	}

	public String getCallId()
	{
		return call.getCallId();
	}

	public String getServiceId()
	{
		return call.getServiceId();
	}

	public <T> Future<T> submit(final CallFunction<T> fun)
	{
		return worker.submit(new Callable<T>()
		{
			public T call() throws Exception
			{
				return fun.apply(call);
			}
		});
	}

	/**
	 * Whether the caller is the worker of this call, i.e. is already running
	 * a function for it
	 */
	public boolean isCurrentThread()
	{
		return Thread.currentThread() == workerThread;
	}

	/**
	 * Applies the function right away; only for the worker itself
	 */
	<T> T applyInline(CallFunction<T> fun) throws SubscriptionException
	{
		if (!isCurrentThread())
		{
			throw new IllegalStateException("Not the worker of call " + call.getCallId());
		}
		return fun.apply(call);
	}

	public boolean isStopped()
	{
		return worker.isShutdown();
	}

	/**
	 * Stops the worker once the work already queued is done
	 */
	public synchronized void stop()
	{
		if (worker.isShutdown())
		{
			return;
		}
		worker.submit(new Runnable()
		{
			public void run()
			{
				call.close();
			}
		});
		worker.shutdown();
		logger.debug("[[" + call.getCallId() + "]] Call stopped");
	}
}
