package com.market.sensitivity.smoothing;

import com.market.sensitivity.series.TimeSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class GapFiller {

    private GapFiller() {}

    public static TimeSeries forwardFill(TimeSeries in) {
        List<Double> out = new ArrayList<>(in.size());
        Double last = null;
        for (Double v : in.values()) {
            last = (v != null) ? v : last;
            out.add(last);
        }
        return in.withValues(out);
    }

    public static TimeSeries backFill(TimeSeries in) {
        List<Double> out = new ArrayList<>(in.size());
        Double next = null;
        for (int i = in.size() - 1; i >= 0; --i) {
            Double v = in.valueAt(i);
            next = (v != null) ? v : next;
            out.add(next);
        }
        Collections.reverse(out);
        return in.withValues(out);
    }
}
