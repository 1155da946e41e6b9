/**
 * Enum assembly and registration.
 *
 * <p>{@link com.ryuqq.enumkit.application.factory.EnumFactory} validates members, builds the
 * immutable {@link com.ryuqq.enumkit.core.model.Enumeration} and registers it through the
 * {@link com.ryuqq.enumkit.core.spi.EnumRegistry} SPI. Behavior is tuned by
 * {@link com.ryuqq.enumkit.application.factory.EnumFactoryConfig}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.enumkit.application.factory;
