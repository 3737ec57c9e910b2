/**
 * Error taxonomy shared by every core module.
 * <ul>
 *   <li>{@link com.metagov.errors.NotFoundException} and subtypes: absent plugin, action, process or account</li>
 *   <li>{@link com.metagov.errors.InvalidParametersException} / {@link com.metagov.errors.InvalidResultException}: schema mismatch</li>
 *   <li>{@link com.metagov.errors.DuplicateLinkException} / {@link com.metagov.errors.IntegrityViolationException}: structural invariant breach</li>
 *   <li>{@link com.metagov.errors.PluginInternalException}: integration failure against an external system</li>
 * </ul>
 */
package com.metagov.errors;
