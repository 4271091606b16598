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
 * Dialog operations the subscription layer relies on
 *
 */
public interface DialogLayer
{
	/**
	 * Handle the peer uses for the same dialog.
	 *
	 * @param handle local dialog handle
	 * @param remoteServiceId service on the other end of the dialog
	 */
	DialogHandle remoteId(DialogHandle handle, String remoteServiceId) throws SubscriptionException;
}
