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
 * The text is not a subscription (or dialog) handle, or its payload cannot be decoded
 *
 */
public class InvalidHandleException extends SubscriptionException
{
	private static final long serialVersionUID = 1L;

	public InvalidHandleException(String handle)
	{
		super("invalid_handle: " + handle);
	}

	public InvalidHandleException(String handle, Throwable cause)
	{
		super("invalid_handle: " + handle, cause);
	}
}
