/*
 * Copyright 2014 Tyler Ward.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.columbia.tjw.spline;

/**
 * Thrown when the input to a spline construction is malformed: mismatched
 * lengths, too few points, non-finite values, or abscissas that are not
 * ascending.
 *
 * @author tyler
 */
public final class SplineValidationException extends IllegalArgumentException
{
    private static final long serialVersionUID = 0x5e1a3c0d92b7f41aL;

    public SplineValidationException(final String message_)
    {
        super(message_);
    }

}
