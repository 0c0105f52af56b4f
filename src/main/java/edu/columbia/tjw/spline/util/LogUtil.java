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
package edu.columbia.tjw.spline.util;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 *
 * @author tyler
 */
public final class LogUtil
{
    /**
     * Parent logger of everything in this library.
     */
    public static final String ROOT_LOGGER_NAME = "edu.columbia.tjw.spline";

    private LogUtil()
    {
    }

    public static Logger getLogger(final Class<?> clazz_)
    {
        final String name = clazz_.getName();
        final Logger output = Logger.getLogger(name);
        return output;
    }

    /**
     * Send this library's log output (at or above the given level) to the
     * console, one line per record. Calling this more than once replaces the
     * previously installed handler.
     *
     * @param level_ The lowest level to print
     * @return The handler that was installed
     */
    public static synchronized Handler enableConsoleLogging(final Level level_)
    {
        final Logger root = Logger.getLogger(ROOT_LOGGER_NAME);

        for (final Handler next : root.getHandlers())
        {
            if (next instanceof LineHandler)
            {
                root.removeHandler(next);
            }
        }

        final Handler handler = new LineHandler();
        handler.setLevel(level_);
        root.addHandler(handler);
        root.setLevel(level_);
        root.setUseParentHandlers(false);
        return handler;
    }

    /**
     * Formats a record as "[date][logger][level]: message".
     *
     * @param record_ The record to format
     * @return The formatted line, without a trailing newline
     */
    public static String formatRecord(final LogRecord record_)
    {
        final DateFormat format = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");
        final Date recDate = new Date(record_.getMillis());
        final String dateString = format.format(recDate);

        final StringBuilder builder = new StringBuilder();

        builder.append("[");
        builder.append(dateString);
        builder.append("][");
        builder.append(record_.getLoggerName());
        builder.append("][");
        builder.append(record_.getLevel());
        builder.append("]: ");
        builder.append(record_.getMessage());

        return builder.toString();
    }

    private static final class LineHandler extends Handler
    {
        @Override
        public synchronized void publish(LogRecord record)
        {
            if (!isLoggable(record))
            {
                return;
            }

            System.out.println(formatRecord(record));

            final Throwable t = record.getThrown();

            if (null != t)
            {
                t.printStackTrace(System.out);
            }
        }

        @Override
        public void flush()
        {
            System.out.flush();
        }

        @Override
        public void close() throws SecurityException
        {
            //Do nothing.
        }

    }

}
