@NamedInterface("api")
package kr.jemi.zaccess.inventory.api;

import org.springframework.modulith.NamedInterface;
