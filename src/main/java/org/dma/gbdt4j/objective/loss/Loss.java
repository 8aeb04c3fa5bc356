package org.dma.gbdt4j.objective.loss;

import org.dma.gbdt4j.exception.InvalidParamException;
import org.dma.gbdt4j.objective.metric.EvalMetric;

import java.io.Serializable;

public interface Loss extends Serializable {
    Kind getKind();

    EvalMetric.Kind defaultEvalMetric();

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
            throw new InvalidParamException("Unrecognizable loss function: " + name);
        }

        @Override
        public String toString() {
            return kind;
        }
    }
}
