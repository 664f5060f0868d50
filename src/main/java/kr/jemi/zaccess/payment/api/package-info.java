@NamedInterface("api")
package kr.jemi.zaccess.payment.api;

import org.springframework.modulith.NamedInterface;
