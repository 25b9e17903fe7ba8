/**
 * Step implementer contract and plugin registry.
 * <ul>
 *   <li>{@link com.tssc.step.StepImplementer} – lifecycle: configure, validate, execute, record</li>
 *   <li>{@link com.tssc.step.StepImplementerProvider} – SPI for discovery (ServiceLoader)</li>
 *   <li>{@link com.tssc.step.StepImplementerRegistry} – lookup by step and implementer name</li>
 *   <li>{@link com.tssc.step.StepConfigurationException}, {@link com.tssc.step.StepExecutionException} – fatal errors</li>
 * </ul>
 */
package com.tssc.step;
