package com.fieldinsight.reporting.core.model.result;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;
import java.util.OptionalDouble;

/**
 * 指标取值
 * 缺失/非法取值统一为 {@link #NO_VALUE}，与真实的 0 可区分；JSON 中表示为 null
 */
@JsonSerialize(using = MeasureValue.Serializer.class)
@JsonDeserialize(using = MeasureValue.Deserializer.class)
public final class MeasureValue {

    public static final MeasureValue NO_VALUE = new MeasureValue(Double.NaN, false);

    private final double value;
    private final boolean present;

    private MeasureValue(double value, boolean present) {
        this.value = value;
        this.present = present;
    }

    /**
     * NaN 和无穷大同样视为无值
     */
    public static MeasureValue of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return NO_VALUE;
        }
        return new MeasureValue(value, true);
    }

    public boolean isPresent() {
        return present;
    }

    public OptionalDouble asOptional() {
        return present ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * @throws IllegalStateException 无值时调用
     */
    public double doubleValue() {
        if (!present) {
            throw new IllegalStateException("Measure has no value");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeasureValue)) {
            return false;
        }
        MeasureValue other = (MeasureValue) o;
        if (!present || !other.present) {
            return present == other.present;
        }
        return Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return present ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return present ? Double.toString(value) : "NoValue";
    }

    static class Serializer extends JsonSerializer<MeasureValue> {
        @Override
        public void serialize(MeasureValue v, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (v.present) {
                gen.writeNumber(v.value);
            } else {
                gen.writeNull();
            }
        }
    }

    static class Deserializer extends JsonDeserializer<MeasureValue> {
        @Override
        public MeasureValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken().isNumeric()) {
                return MeasureValue.of(p.getDoubleValue());
            }
            return NO_VALUE;
        }

        @Override
        public MeasureValue getNullValue(DeserializationContext ctxt) {
            return NO_VALUE;
        }
    }
}
