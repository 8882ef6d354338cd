package com.clinic.scheduling.auth;

import com.clinic.scheduling.exception.UnauthenticatedException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;

/**
 * Builds the {@link CallerIdentity} from the headers the gateway adds after authenticating a request.
 */
@Component
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        String userId = StringUtils.trimToNull(webRequest.getHeader(USER_ID_HEADER));
        String role = StringUtils.trimToNull(webRequest.getHeader(ROLE_HEADER));
        if (userId == null || role == null) {
            throw new UnauthenticatedException("Missing caller identity.");
        }
        try {
            return new CallerIdentity(Long.valueOf(userId), CallerRole.valueOf(role.toUpperCase(Locale.ENGLISH)));
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Malformed caller identity.");
        }
    }
}
