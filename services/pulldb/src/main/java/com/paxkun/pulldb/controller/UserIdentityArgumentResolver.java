package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.UserIdentity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link UserIdentity} handler argument from the headers set by the
 * authenticating proxy in front of PullDB.
 *
 * Author: Pax
 */
public class UserIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_HEADER = "X-Pulldb-User";
    public static final String TRUSTED_HEADER = "X-Pulldb-Trusted";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return UserIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public UserIdentity resolveArgument(MethodParameter parameter,
                                        ModelAndViewContainer mavContainer,
                                        NativeWebRequest webRequest,
                                        WebDataBinderFactory binderFactory) {
        String user = webRequest.getHeader(USER_HEADER);
        if (user == null || user.isBlank()) {
            throw new MissingUserException("Missing " + USER_HEADER + " header");
        }
        boolean trusted = Boolean.parseBoolean(webRequest.getHeader(TRUSTED_HEADER));
        return new UserIdentity(user.trim(), trusted);
    }
}
