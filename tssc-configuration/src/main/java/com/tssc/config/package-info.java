/**
 * Step configuration resolution.
 * <ul>
 *   <li>{@link com.tssc.config.ConfigValue} – leaf value with source and path, plus unwrap helpers</li>
 *   <li>{@link com.tssc.config.ConfigMerger} – pure deep merge over ordered layers</li>
 *   <li>{@link com.tssc.config.SubStepConfig} – six-layer precedence for one sub step</li>
 *   <li>{@link com.tssc.config.StepConfig}, {@link com.tssc.config.Config} – parsed pipeline definition</li>
 * </ul>
 */
package com.tssc.config;
