package com.radioautomation.intake.service.relocation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.Args;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component("relocationRetryListener")
@Slf4j
public class RelocationRetryListener implements RetryListener {

    /**
     * Attribute under which the retry interceptor stores the arguments of the intercepted call.
     */
    private static final String ARGS_ATTRIBUTE = "ARGS";

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (context.getRetryCount() > 0) {
            log.warn("Writing output file '{}' failed on attempt {}. Retrying...", destinationName(context),
                     context.getRetryCount(), throwable);
        }
    }

    /**
     * Resolves the destination of {@link OutputFileWriter#copy(Path, Path)} from the retry context.
     */
    String destinationName(RetryContext context) {
        Object attribute = context.getAttribute(ARGS_ATTRIBUTE);
        if (attribute instanceof Args) {
            Object[] args = ((Args) attribute).getArgs();
            if (args != null && args.length > 1 && args[1] instanceof Path) {
                return String.valueOf(((Path) args[1]).getFileName());
            }
        }
        return "UnknownFile";
    }
}
