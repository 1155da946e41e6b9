/**
 * Contract test infrastructure for {@link com.ryuqq.enumkit.core.spi.EnumRegistry} adapters.
 *
 * <p>Adapters extend {@link com.ryuqq.enumkit.testkit.contract.AbstractEnumRegistryContractTest}
 * from their own test sources to inherit the full registry contract.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.testkit.contract;
