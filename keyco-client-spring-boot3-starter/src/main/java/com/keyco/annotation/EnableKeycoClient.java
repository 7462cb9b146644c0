package com.keyco.annotation;

import java.lang.annotation.*;

/**
 * 标注在配置类上, 覆盖 keyco.client.preflight.connectivity-check-enabled
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableKeycoClient {

    /**
     * 首次尝试前是否探测连通性
     */
    boolean value() default true;
}
