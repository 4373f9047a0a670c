package cn.ashersu.taskify.manager;

import org.springframework.jdbc.core.SqlTypeValue;

import java.sql.Types;
import java.util.Objects;

/**
 * 命名参数的取值：整数、文本、布尔或 NULL。
 */
public sealed interface SqlValue permits SqlValue.IntValue, SqlValue.TextValue, SqlValue.BoolValue, SqlValue.NullValue {

    /** 绑定到 PreparedStatement 的值 */
    Object jdbcValue();

    /** {@link java.sql.Types} 常量 */
    int sqlType();

    static SqlValue of(long number) {
        return new IntValue(number);
    }

    static SqlValue of(String text) {
        return text == null ? nullValue() : new TextValue(text);
    }

    static SqlValue of(boolean flag) {
        return new BoolValue(flag);
    }

    /**
     * 将任意 Java 值转换为参数值，只接受 Integer/Long/Short/Byte、String、Boolean 与 null。
     *
     * @throws IllegalArgumentException 其他类型
     */
    static SqlValue of(Object value) {
        if (value == null) {
            return nullValue();
        }
        if (value instanceof SqlValue v) {
            return v;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof String s) {
            return new TextValue(s);
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        throw new IllegalArgumentException("Unsupported parameter type: " + value.getClass().getName());
    }

    /** 类型未知的 NULL，由驱动根据参数元数据决定类型 */
    static SqlValue nullValue() {
        return new NullValue(SqlTypeValue.TYPE_UNKNOWN);
    }

    static SqlValue nullOf(int sqlType) {
        return new NullValue(sqlType);
    }

    record IntValue(long number) implements SqlValue {
        @Override
        public Object jdbcValue() {
            return number;
        }

        @Override
        public int sqlType() {
            return Types.BIGINT;
        }
    }

    record TextValue(String text) implements SqlValue {
        public TextValue {
            Objects.requireNonNull(text, "text required, use nullOf(Types.NVARCHAR) for NULL");
        }

        @Override
        public Object jdbcValue() {
            return text;
        }

        @Override
        public int sqlType() {
            return Types.NVARCHAR;
        }
    }

    record BoolValue(boolean flag) implements SqlValue {
        @Override
        public Object jdbcValue() {
            return flag;
        }

        @Override
        public int sqlType() {
            return Types.BOOLEAN;
        }
    }

    record NullValue(int sqlType) implements SqlValue {
        @Override
        public Object jdbcValue() {
            return null;
        }
    }
}
