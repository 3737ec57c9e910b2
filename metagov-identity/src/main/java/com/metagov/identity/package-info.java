/**
 * Identity resolution: MetagovIds (one per logical participant, linked into groups with exactly one
 * primary) and the platform accounts bound to them.
 * <ul>
 *   <li>{@link com.metagov.identity.IdentityResolutionEngine}: create, link, upgrade, merge, resolve primary</li>
 *   <li>{@link com.metagov.identity.LinkQuality}: total order that decides whether new link data may replace stored data</li>
 *   <li>{@link com.metagov.identity.PlatformScope}: community + platform + community platform id of an account</li>
 * </ul>
 */
package com.metagov.identity;
