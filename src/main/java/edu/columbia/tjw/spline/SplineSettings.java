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

import java.io.Serializable;

/**
 *
 * Settings that control how splines are constructed.
 *
 * All the members are final so that this thing is threadsafe. Use the builder
 * to make adjusted versions of this class.
 *
 * @author tyler
 */
public final class SplineSettings implements Serializable
{
    private static final long serialVersionUID = 0x4d2b7a91e6c30f52L;

    private static final double DEFAULT_DEGENERATE_TOLERANCE = 1.0e-12;
    private static final boolean DEFAULT_COPY_INPUTS = true;
    private static final boolean DEFAULT_LOG_SUMMARY = false;

    private static final SplineSettings DEFAULT = new SplineSettings();

    //An inserted knot closer than (tolerance * h) to either end of its interval is degenerate.
    private final double _degenerateTolerance;
    private final boolean _copyInputs;
    private final boolean _logSummary;

    public SplineSettings()
    {
        _degenerateTolerance = DEFAULT_DEGENERATE_TOLERANCE;
        _copyInputs = DEFAULT_COPY_INPUTS;
        _logSummary = DEFAULT_LOG_SUMMARY;
    }

    public SplineSettings(final SplineSettingsBuilder builder_)
    {
        _degenerateTolerance = builder_.getDegenerateTolerance();
        _copyInputs = builder_.isCopyInputs();
        _logSummary = builder_.isLogSummary();
    }

    public static SplineSettings getDefault()
    {
        return DEFAULT;
    }

    public double getDegenerateTolerance()
    {
        return _degenerateTolerance;
    }

    public boolean isCopyInputs()
    {
        return _copyInputs;
    }

    public boolean isLogSummary()
    {
        return _logSummary;
    }

    public SplineSettingsBuilder makeBuilder()
    {
        return new SplineSettingsBuilder(this);
    }

    @Override
    public String toString()
    {
        return "SplineSettings[degenerateTolerance=" + _degenerateTolerance + ", copyInputs=" + _copyInputs
                + ", logSummary=" + _logSummary + "]";
    }

    public static final class SplineSettingsBuilder
    {
        private double _degenerateTolerance;
        private boolean _copyInputs;
        private boolean _logSummary;

        public SplineSettingsBuilder()
        {
            this(DEFAULT);
        }

        public SplineSettingsBuilder(final SplineSettings base_)
        {
            _degenerateTolerance = base_.getDegenerateTolerance();
            _copyInputs = base_.isCopyInputs();
            _logSummary = base_.isLogSummary();
        }

        public SplineSettings build()
        {
            return new SplineSettings(this);
        }

        public double getDegenerateTolerance()
        {
            return _degenerateTolerance;
        }

        public SplineSettingsBuilder setDegenerateTolerance(final double degenerateTolerance_)
        {
            if (!(degenerateTolerance_ >= 0.0) || degenerateTolerance_ >= 0.5)
            {
                throw new IllegalArgumentException("Degenerate tolerance must be in [0, 0.5): " + degenerateTolerance_);
            }

            _degenerateTolerance = degenerateTolerance_;
            return this;
        }

        public boolean isCopyInputs()
        {
            return _copyInputs;
        }

        public SplineSettingsBuilder setCopyInputs(final boolean copyInputs_)
        {
            _copyInputs = copyInputs_;
            return this;
        }

        public boolean isLogSummary()
        {
            return _logSummary;
        }

        public SplineSettingsBuilder setLogSummary(final boolean logSummary_)
        {
            _logSummary = logSummary_;
            return this;
        }
    }

}
