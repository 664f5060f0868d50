@NamedInterface("api")
package kr.jemi.zaccess.audit.api;

import org.springframework.modulith.NamedInterface;
