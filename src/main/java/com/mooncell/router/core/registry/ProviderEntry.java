package com.mooncell.router.core.registry;

import com.mooncell.router.core.client.ClientFactory;
import com.mooncell.router.core.model.ProviderDescriptor;
import com.mooncell.router.core.model.ProviderKind;
import lombok.ToString;
import lombok.Value;

/**
 * 快照中一个已构建成功的服务商
 */
@Value
public class ProviderEntry {
    ProviderDescriptor descriptor;
    ProviderKind kind;
    /** 网关解析出的基础地址（不含后端版本前缀） */
    String endpointBaseUrl;
    @ToString.Exclude
    ClientFactory clientFactory;

    public String getProviderId() {
        return descriptor.getProviderId();
    }
}
