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
 * A field name with the value read for it
 *
 */
public final class FieldValue
{
	private final String name;
	private final Object value;

	public FieldValue(String name, Object value)
	{
		this.name = name;
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof FieldValue))
		{
			return false;
		}
		FieldValue other = (FieldValue) o;
		return name.equals(other.name) && (value == null ? other.value == null : value.equals(other.value));
	}

	@Override
	public int hashCode()
	{
		return 31 * name.hashCode() + (value == null ? 0 : value.hashCode());
	}

	@Override
	public String toString()
	{
		return name + "=" + value;
	}
}
