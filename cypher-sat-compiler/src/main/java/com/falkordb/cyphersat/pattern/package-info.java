/**
 * Pattern trees and the extractor that reads node and relationship
 * elements out of them.
 */
package com.falkordb.cyphersat.pattern;
