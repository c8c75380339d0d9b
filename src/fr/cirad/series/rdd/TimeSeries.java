/*******************************************************************************
 * MGDB Series - indexed series transforms, queries and factorization
 * Copyright (C) 2016 - 2025, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.series.rdd;

import fr.cirad.series.model.Index;
import fr.cirad.series.model.SeriesRecord;
import fr.cirad.series.parallel.ParallelCollection;

/**
 * A series whose index is known to describe time points.
 * Holds the same records as the series it was converted from.
 */
public class TimeSeries extends Series {

    public TimeSeries(Series series) {
        super(series);
    }

    @Override
    protected Series newInstance(ParallelCollection<SeriesRecord> newRecords, Index newIndex) {
        return new TimeSeries(new Series(newRecords, newIndex, config));
    }

    @Override
    public TimeSeries toTimeSeries() {
        return this;
    }
}
