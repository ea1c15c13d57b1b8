package group.cloudtrailsource.config;

import group.cloudtrailsource.SourceException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Options recognised when opening a CloudTrail source session.
 * Values come from the open parameters first, then from environment variables, then defaults.
 */
public final class SourceConfig {

    public static final String DOWNLOAD_CONCURRENCY = "downloadConcurrency";
    public static final String INTERVAL = "interval";
    public static final String ACCOUNT_LIST = "accountList";
    public static final String USE_S3_SNS = "useS3SNS";
    public static final String SQS_DELETE = "sqsDelete";
    public static final String SQS_OWNER_ACCOUNT = "sqsOwnerAccount";

    static final int DEFAULT_DOWNLOAD_CONCURRENCY = 32;

    private static final Pattern ACCOUNT_LIST_PATTERN = Pattern.compile("^\\s*(?:\\d{12}\\s*(?:,\\s*\\d{12}\\s*)*,?)?\\s*$");

    private final int downloadConcurrency;
    private final String interval;
    private final String accountList;
    private final boolean useS3Sns;
    private final boolean sqsDelete;
    private final String sqsOwnerAccount;

    private SourceConfig(Builder builder) {
        this.downloadConcurrency = builder.downloadConcurrency;
        this.interval = builder.interval;
        this.accountList = builder.accountList;
        this.useS3Sns = builder.useS3Sns;
        this.sqsDelete = builder.sqsDelete;
        this.sqsOwnerAccount = builder.sqsOwnerAccount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SourceConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config from open parameters, falling back to environment variables named in
     * upper snake case (e.g. DOWNLOAD_CONCURRENCY).
     */
    public static SourceConfig fromMap(Map<String, ?> params) {
        return fromMap(params, System::getenv);
    }

    static SourceConfig fromMap(Map<String, ?> params, Function<String, String> env) {
        Builder builder = builder();
        String concurrency = lookup(params, env, DOWNLOAD_CONCURRENCY, "DOWNLOAD_CONCURRENCY");
        if (concurrency != null) {
            try {
                builder.downloadConcurrency(Integer.parseInt(concurrency.trim()));
            } catch (NumberFormatException e) {
                throw SourceException.badConfiguration("config", "invalid " + DOWNLOAD_CONCURRENCY + ": \"" + concurrency + "\"");
            }
        }
        String interval = lookup(params, env, INTERVAL, "INTERVAL");
        if (interval != null) {
            builder.interval(interval);
        }
        String accountList = lookup(params, env, ACCOUNT_LIST, "ACCOUNT_LIST");
        if (accountList != null) {
            builder.accountList(accountList);
        }
        String useS3Sns = lookup(params, env, USE_S3_SNS, "USE_S3_SNS");
        if (useS3Sns != null) {
            builder.useS3Sns(Boolean.parseBoolean(useS3Sns.trim()));
        }
        String sqsDelete = lookup(params, env, SQS_DELETE, "SQS_DELETE");
        if (sqsDelete != null) {
            builder.sqsDelete(Boolean.parseBoolean(sqsDelete.trim()));
        }
        String owner = lookup(params, env, SQS_OWNER_ACCOUNT, "SQS_OWNER_ACCOUNT");
        if (owner != null) {
            builder.sqsOwnerAccount(owner.trim());
        }
        return builder.build();
    }

    private static String lookup(Map<String, ?> params, Function<String, String> env, String key, String envName) {
        Object value = params == null ? null : params.get(key);
        if (value != null) {
            return value.toString();
        }
        return env.apply(envName);
    }

    public int getDownloadConcurrency() {
        return downloadConcurrency;
    }

    public String getInterval() {
        return interval;
    }

    public String getAccountList() {
        return accountList;
    }

    /**
     * Whether queue messages carry native S3 "object created" events rather than the
     * CloudTrail {s3Bucket, s3ObjectKey} notification.
     */
    public boolean isUseS3Sns() {
        return useS3Sns;
    }

    public boolean isSqsDelete() {
        return sqsDelete;
    }

    public String getSqsOwnerAccount() {
        return sqsOwnerAccount;
    }

    /**
     * Validates the account list and splits it into trimmed 12-digit account ids.
     * An empty list means "discover accounts by listing".
     */
    public List<String> accountIds() {
        if (!ACCOUNT_LIST_PATTERN.matcher(accountList).matches()) {
            throw SourceException.badConfiguration("config", "invalid account list: \"" + accountList + "\"");
        }
        return Arrays.stream(accountList.split(","))
                .map(String::trim)
                .filter(account -> !account.isEmpty())
                .toList();
    }

    public void requirePositiveConcurrency() {
        if (downloadConcurrency < 1) {
            throw SourceException.badConfiguration("config", "invalid " + DOWNLOAD_CONCURRENCY + ": \"" + downloadConcurrency + "\"");
        }
    }

    @Override
    public String toString() {
        return "SourceConfig{downloadConcurrency=" + downloadConcurrency
                + ", interval='" + interval + "'"
                + ", accountList='" + accountList + "'"
                + ", useS3Sns=" + useS3Sns
                + ", sqsDelete=" + sqsDelete
                + ", sqsOwnerAccount='" + sqsOwnerAccount + "'}";
    }

    public static final class Builder {
        private int downloadConcurrency = DEFAULT_DOWNLOAD_CONCURRENCY;
        private String interval = "";
        private String accountList = "";
        private boolean useS3Sns = false;
        private boolean sqsDelete = true;
        private String sqsOwnerAccount = "";

        private Builder() {
        }

        public Builder downloadConcurrency(int downloadConcurrency) {
            this.downloadConcurrency = downloadConcurrency;
            return this;
        }

        public Builder interval(String interval) {
            this.interval = interval == null ? "" : interval;
            return this;
        }

        public Builder accountList(String accountList) {
            this.accountList = accountList == null ? "" : accountList;
            return this;
        }

        public Builder useS3Sns(boolean useS3Sns) {
            this.useS3Sns = useS3Sns;
            return this;
        }

        public Builder sqsDelete(boolean sqsDelete) {
            this.sqsDelete = sqsDelete;
            return this;
        }

        public Builder sqsOwnerAccount(String sqsOwnerAccount) {
            this.sqsOwnerAccount = sqsOwnerAccount == null ? "" : sqsOwnerAccount;
            return this;
        }

        public SourceConfig build() {
            return new SourceConfig(this);
        }
    }
}
