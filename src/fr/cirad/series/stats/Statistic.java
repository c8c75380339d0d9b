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
package fr.cirad.series.stats;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;

import fr.cirad.series.exceptions.UnknownStatisticException;

/**
 * Per-record statistics, all computed with population formulas.
 */
public enum Statistic {

    MEAN("mean") {
        @Override
        public double of(StatCounter counter) {
            return counter.mean();
        }
    },
    SUM("sum") {
        @Override
        public double of(StatCounter counter) {
            return counter.sum();
        }
    },
    STDEV("stdev") {
        @Override
        public double of(StatCounter counter) {
            return counter.stdev();
        }
    },
    VARIANCE("variance") {
        @Override
        public double of(StatCounter counter) {
            return counter.variance();
        }
    },
    COUNT("count") {
        @Override
        public double of(StatCounter counter) {
            return counter.count();
        }
    },
    MIN("min") {
        @Override
        public double of(StatCounter counter) {
            return counter.min();
        }
    },
    MAX("max") {
        @Override
        public double of(StatCounter counter) {
            return counter.max();
        }
    };

    private final String label;

    Statistic(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract double of(StatCounter counter);

    public static Statistic fromName(String name) {
        if (name != null)
            for (Statistic stat : values())
                if (stat.label.equalsIgnoreCase(name.trim()))
                    return stat;
        throw new UnknownStatisticException(name, StringUtils.join(labels(), ", "));
    }

    public static List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (Statistic stat : values())
            labels.add(stat.label);
        return labels;
    }
}
