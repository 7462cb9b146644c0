package com.keyco.core.spi;

import java.util.Optional;

/**
 * Bearer 凭证来源, 宿主可替换为安全存储实现
 */
public interface CredentialStore {

    Optional<String> get();
}
