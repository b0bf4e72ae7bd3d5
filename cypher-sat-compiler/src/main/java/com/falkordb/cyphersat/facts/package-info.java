/**
 * Graph facts and the store interface the builders query.
 *
 * @see com.falkordb.cyphersat.facts.InMemoryFactStore
 */
package com.falkordb.cyphersat.facts;
