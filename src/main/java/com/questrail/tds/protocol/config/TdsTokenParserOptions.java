package com.questrail.tds.protocol.config;

import com.questrail.tds.protocol.model.TdsVersion;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Options consulted by the token stream parser and its token decoders.
 *
 * <p>
 * {@code tdsVersion} must match the revision negotiated at login; several
 * fields change width between 7.1 and 7.2.
 * </p>
 */
public record TdsTokenParserOptions(
    TdsVersion tdsVersion,
    boolean camelCaseColumns,
    boolean lowerCaseGuids,
    Charset varcharCharset,
    int maxFieldLength
) {
    public static final int DEFAULT_MAX_FIELD_LENGTH = 64 * 1024 * 1024;

    public TdsTokenParserOptions {
        Objects.requireNonNull(tdsVersion, "tdsVersion");
        Objects.requireNonNull(varcharCharset, "varcharCharset");
        if (maxFieldLength <= 0) {
            throw new IllegalArgumentException("maxFieldLength must be positive (was " + maxFieldLength + ")");
        }
    }

    public static TdsTokenParserOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TdsVersion tdsVersion = TdsVersion.V7_4;
        private boolean camelCaseColumns = false;
        private boolean lowerCaseGuids = false;
        private Charset varcharCharset = Charset.forName("windows-1252");
        private int maxFieldLength = DEFAULT_MAX_FIELD_LENGTH;

        public Builder withTdsVersion(TdsVersion tdsVersion) {
            this.tdsVersion = tdsVersion;
            return this;
        }

        public Builder withCamelCaseColumns(boolean camelCaseColumns) {
            this.camelCaseColumns = camelCaseColumns;
            return this;
        }

        public Builder withLowerCaseGuids(boolean lowerCaseGuids) {
            this.lowerCaseGuids = lowerCaseGuids;
            return this;
        }

        public Builder withVarcharCharset(Charset varcharCharset) {
            this.varcharCharset = varcharCharset;
            return this;
        }

        public Builder withMaxFieldLength(int maxFieldLength) {
            this.maxFieldLength = maxFieldLength;
            return this;
        }

        public TdsTokenParserOptions build() {
            return new TdsTokenParserOptions(tdsVersion, camelCaseColumns, lowerCaseGuids, varcharCharset, maxFieldLength);
        }
    }
}
