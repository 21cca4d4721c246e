package ai.ralph.executor.failure;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Maps Java exceptions onto the system error codes the failure rules are written against. */
public final class ErrorCodes {
    public static final String ENOENT = "ENOENT";
    public static final String EACCES = "EACCES";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String ENOTFOUND = "ENOTFOUND";
    public static final String ETIMEDOUT = "ETIMEDOUT";

    // ProcessBuilder reports "Cannot run program "x": error=2, No such file or directory"
    private static final Pattern ERRNO = Pattern.compile("error=(\\d+)");

    private ErrorCodes() {}

    /** Error code of {@code error} or any of its causes, or null if none is recognized. */
    public static @Nullable String fromThrowable(@Nullable Throwable error) {
        for (var t = error; t != null; t = t.getCause()) {
            var code = direct(t);
            if (code != null) {
                return code;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static @Nullable String direct(Throwable t) {
        if (t instanceof ConnectException) {
            return ECONNREFUSED;
        }
        if (t instanceof UnknownHostException) {
            return ENOTFOUND;
        }
        if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
            return ETIMEDOUT;
        }
        var message = t.getMessage();
        if (message == null) {
            return null;
        }
        var m = ERRNO.matcher(message);
        if (m.find()) {
            return switch (m.group(1)) {
                case "2" -> ENOENT;
                case "13" -> EACCES;
                default -> null;
            };
        }
        return null;
    }
}
