/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.domain.shoppingcart;

import org.eventcore.domain.shoppingcart.ShoppingCartCommand.AddProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import org.eventcore.errors.IllegalDomainStateException;
import org.eventcore.testsupport.DeciderSpecification;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ShoppingCartDeciderTest {
    private static final PricedProductItem SHOES = new PricedProductItem("shoes", 2, 100);
    private static final PricedProductItem SOCKS = new PricedProductItem("socks", 3, 10);

    private final DeciderSpecification<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> spec = DeciderSpecification.forDecider(new ShoppingCartDecider());

    @Test
    void adding_a_product_to_an_empty_cart_returns_product_item_added() {
        spec.given()
                .when(new AddProductItem(SHOES))
                .then(new ProductItemAdded(SHOES));
    }

    @Test
    void adding_a_product_to_an_opened_cart_returns_product_item_added() {
        spec.given(new ProductItemAdded(SHOES))
                .when(new AddProductItem(SOCKS))
                .then(new ProductItemAdded(SOCKS));
    }

    @Test
    void adding_a_product_to_a_confirmed_cart_is_rejected() {
        IllegalDomainStateException exception = spec.given(new ProductItemAdded(SHOES), new ShoppingCartConfirmed(Instant.now()))
                .when(new AddProductItem(SOCKS))
                .thenThrows(IllegalDomainStateException.class);

        assertThat(exception).hasMessage("Shopping cart is already confirmed");
    }

    @Test
    void confirming_an_empty_cart_is_rejected() {
        spec.given()
                .when(new ConfirmShoppingCart(Instant.now()))
                .thenThrows(IllegalDomainStateException.class, e -> e.getMessage().contains("empty"));
    }

    @Test
    void then_fails_when_decider_returns_other_events() {
        assertThatThrownBy(() -> spec.given().when(new AddProductItem(SHOES)).then(new ProductItemAdded(SOCKS)))
                .isInstanceOf(AssertionError.class);
    }

    @Test
    void evolve_sums_total_amount_and_quantities() {
        // When
        ShoppingCart cart = ShoppingCart.evolve(ShoppingCart.evolve(ShoppingCart.initial(), new ProductItemAdded(SHOES)), new ProductItemAdded(SOCKS));

        // Then
        assertThat(cart.totalAmount()).isEqualTo(230.0);
        assertThat(cart.productItemsCount()).isEqualTo(5);
        assertThat(cart.status()).isEqualTo(ShoppingCartStatus.OPENED);
    }
}
