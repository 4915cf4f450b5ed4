package com.example.omnichat.auth;

import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link AgentPrincipal} controller parameters from the {@code Authorization: Bearer} header.
 */
@Component
@RequiredArgsConstructor
public class AgentPrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    private final AgentTokenService tokenService;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AgentPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public AgentPrincipal resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        return tokenService.authenticateHeader(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
    }
}
