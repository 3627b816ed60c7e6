package com.github.dimitryivaniuta.remotefirewall.firewall;

import com.github.dimitryivaniuta.remotefirewall.firewall.annotations.RemoteEndpoint;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointDefinition;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.EndpointRegistrationException;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallback;
import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteHandler;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Registers {@link RemoteEndpoint}-annotated bean methods with the {@link RemoteHandler}.
 *
 * <p>Runs after initialization so the registered callback targets the fully built bean
 * (including any proxy applied by other post-processors).
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class RemoteEndpointBeanPostProcessor implements BeanPostProcessor {

    private final ObjectProvider<RemoteHandler> handlerProvider;
    private final FirewallProperties props;

    public RemoteEndpointBeanPostProcessor(ObjectProvider<RemoteHandler> handlerProvider, FirewallProperties props) {
        this.handlerProvider = handlerProvider;
        this.props = props;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        if (!props.isEnabled()) return bean;

        Class<?> targetClass = ClassUtils.getUserClass(bean);
        if (isExcluded(targetClass)) return bean;

        for (Method m : targetClass.getMethods()) {
            RemoteEndpoint ann = AnnotatedElementUtils.findMergedAnnotation(m, RemoteEndpoint.class);
            if (ann == null) continue;
            requireCallbackSignature(targetClass, m);
            handlerProvider.getObject().register(EndpointDefinition.builder()
                    .name(ann.name())
                    .kind(ann.kind())
                    .params(ann.params())
                    .forceLogging(ann.forceLogging())
                    .callback(reflectiveCallback(bean, m))
                    .build());
        }
        return bean;
    }

    private static RemoteCallback reflectiveCallback(Object bean, Method method) {
        ReflectionUtils.makeAccessible(method);
        return (callerId, logIndex, args) -> {
            try {
                return method.invoke(bean, callerId, logIndex, args);
            } catch (InvocationTargetException ex) {
                Throwable cause = ex.getTargetException();
                if (cause instanceof Exception e) throw e;
                throw ex;
            }
        };
    }

    static void requireCallbackSignature(Class<?> targetClass, Method m) {
        Class<?>[] p = m.getParameterTypes();
        boolean ok = p.length == 3
                && p[0] == String.class
                && p[1] == long.class
                && p[2] == List.class
                && isRemoteValueList(m.getGenericParameterTypes()[2]);
        if (!ok) {
            throw new EndpointRegistrationException("@RemoteEndpoint method " + targetClass.getSimpleName() + "#"
                    + m.getName() + " must have signature (String callerId, long logIndex, List<RemoteValue> args)");
        }
    }

    private static boolean isRemoteValueList(Type t) {
        if (!(t instanceof ParameterizedType pt)) return false;
        Type[] a = pt.getActualTypeArguments();
        return a.length == 1 && a[0] == RemoteValue.class;
    }

    private static boolean isExcluded(Class<?> targetClass) {
        String name = targetClass.getName();
        return name.startsWith("org.springframework.") || name.startsWith("jakarta.") || name.startsWith("java.")
                || name.startsWith("io.micrometer.") || name.startsWith("com.fasterxml.");
    }
}
