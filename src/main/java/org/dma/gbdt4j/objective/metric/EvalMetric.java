package org.dma.gbdt4j.objective.metric;

import org.dma.gbdt4j.exception.InvalidParamException;

import java.io.Serializable;

public interface EvalMetric extends Serializable {
    Kind getKind();

    double sum(double[] preds, double[] labels);

    double avg(double sum, int num);

    double eval(double[] preds, double[] labels);

    double evalOne(double pred, double label);

    public enum Kind {
        RMSE("rmse");

        private final String kind;

        private Kind(String kind) {
            this.kind = kind;
        }

        public static Kind fromString(String name) {
            for (Kind kind : values()) {
                if (kind.kind.equalsIgnoreCase(name))
                    return kind;
            }
            throw new InvalidParamException("Unrecognizable eval metric: " + name);
        }

        @Override
        public String toString() {
            return kind;
        }
    }
}
