package com.ryuqq.enumkit.testkit.contract;

import com.ryuqq.enumkit.core.spi.EnumRegistry;

/**
 * Runs the registry contract against {@link ReferenceEnumRegistry}.
 *
 * <p>Keeps the contract itself honest: any test that fails here is a broken
 * contract test, not a broken adapter.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReferenceEnumRegistryContractTest extends AbstractEnumRegistryContractTest {

    @Override
    protected EnumRegistry createRegistry() {
        return new ReferenceEnumRegistry();
    }
}
