// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.array;

/**
 * How a container holds its elements.
 */
public enum ElementKind {
    /**
     * Elements are stored by reference and copied flatly: the same object may live in several containers.
     */
    VALUE,
    /**
     * Elements are exclusively owned by the container and deep-copied whenever they cross a container boundary.
     */
    OWNED
}
