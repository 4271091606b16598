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


/**
 * Access to the dialogs of running calls.
 * <p>
 * Every call has a single worker; functions submitted for the same call run
 * one after the other, functions for different calls do not wait on each other.
 * </p>
 */
public interface CallBridge
{
	/**
	 * Runs the function against the dialog and waits for its result.
	 * A function of a call may use the bridge on that same call: the nested
	 * function is applied at once, in the same worker.
	 *
	 * @throws CallNotFoundException if the call or the dialog does not exist,
	 *         or the call did not answer in time
	 * @throws SubscriptionException whatever the function raised
	 */
	<T> T applyDialog(String serviceId, String callId, String dialogId, DialogFunction<T> fun) throws SubscriptionException;
}
