package com.mooncell.router.core.client;

/**
 * 模型名 -> 可调用模型句柄
 * <p>
 * 每个服务商独占一个实例；实现必须是无状态的，可并发调用，创建句柄不得修改自身状态。
 */
@FunctionalInterface
public interface ClientFactory {

    InvocableModel create(String modelName);
}
